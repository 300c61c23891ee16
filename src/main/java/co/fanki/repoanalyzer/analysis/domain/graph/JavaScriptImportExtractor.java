package co.fanki.repoanalyzer.analysis.domain.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads ES6 imports, CommonJS requires and dynamic imports from
 * JavaScript and TypeScript sources.
 *
 * <p>Only bare package specifiers are kept. Relative ({@code ./x}) and
 * absolute ({@code /x}) specifiers are skipped. A specifier is reduced to
 * its package: {@code lodash/fp} yields {@code lodash} and
 * {@code @scope/pkg/deep} yields {@code @scope/pkg}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaScriptImportExtractor extends ImportExtractor {

    /** Matches ES6 {@code import ... from 'x'}. */
    private static final Pattern ES6_IMPORT_PATTERN = Pattern.compile(
            "import\\s+.*?from\\s+['\"]([^'\"]+)['\"]");

    /** Matches CommonJS {@code require('x')}. */
    private static final Pattern REQUIRE_PATTERN = Pattern.compile(
            "require\\s*\\(['\"]([^'\"]+)['\"]\\)");

    /** Matches dynamic {@code import('x')}. */
    private static final Pattern DYNAMIC_IMPORT_PATTERN = Pattern.compile(
            "import\\s*\\(['\"]([^'\"]+)['\"]\\)");

    private static final List<Pattern> PATTERNS = List.of(
            ES6_IMPORT_PATTERN, REQUIRE_PATTERN, DYNAMIC_IMPORT_PATTERN);

    @Override
    public String language() {
        return "JavaScript";
    }

    @Override
    protected List<String> suffixes() {
        return List.of(".js", ".jsx", ".ts", ".tsx");
    }

    @Override
    protected List<String> extractIdentifiers(final String content) {
        final List<String> packages = new ArrayList<>();

        for (final Pattern pattern : PATTERNS) {
            final Matcher matcher = pattern.matcher(content);
            while (matcher.find()) {
                final String specifier = matcher.group(1);
                if (!specifier.startsWith(".") && !specifier.startsWith("/")) {
                    packages.add(packageOf(specifier));
                }
            }
        }
        return packages;
    }

    /**
     * Reduces a bare specifier to its package name.
     *
     * @param specifier the import specifier
     * @return the package, scoped packages keep their scope
     */
    static String packageOf(final String specifier) {
        final String[] segments = specifier.split("/", -1);
        if (segments[0].startsWith("@") && segments.length > 1) {
            return segments[0] + "/" + segments[1];
        }
        return segments[0];
    }

}
