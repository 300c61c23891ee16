package co.fanki.repoanalyzer.analysis.domain.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads {@code import x} and {@code from x import y} statements.
 *
 * <p>Lines are trimmed first, so indented imports count. Only the first
 * dotted component is kept: {@code from pkg.sub import y} yields
 * {@code pkg}. Relative imports ({@code from . import x}) yield
 * nothing. Module names may hold any Unicode word character.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PythonImportExtractor extends ImportExtractor {

    private static final Pattern IMPORT_PATTERN = Pattern.compile(
            "^import\\s+([\\w.]+)", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern FROM_IMPORT_PATTERN = Pattern.compile(
            "^from\\s+([\\w.]+)\\s+import",
            Pattern.UNICODE_CHARACTER_CLASS);

    private static final List<Pattern> PATTERNS = List.of(
            IMPORT_PATTERN, FROM_IMPORT_PATTERN);

    @Override
    public String language() {
        return "Python";
    }

    @Override
    protected List<String> suffixes() {
        return List.of(".py");
    }

    @Override
    protected List<String> extractIdentifiers(final String content) {
        final List<String> modules = new ArrayList<>();

        for (final String raw : content.split("\n")) {
            final String line = raw.trim();
            for (final Pattern pattern : PATTERNS) {
                final Matcher matcher = pattern.matcher(line);
                if (matcher.find()) {
                    final String module = topLevel(matcher.group(1));
                    if (!module.isEmpty()) {
                        modules.add(module);
                    }
                    break;
                }
            }
        }
        return modules;
    }

    private static String topLevel(final String module) {
        final int dot = module.indexOf('.');
        return dot < 0 ? module : module.substring(0, dot);
    }

}
