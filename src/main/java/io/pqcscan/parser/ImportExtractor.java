package io.pqcscan.parser;

import io.pqcscan.model.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts import/require/use/include references, one language at a time.
 * Module names are recorded verbatim; nothing is resolved or followed.
 */
class ImportExtractor {

    // Python
    private static final Pattern PY_IMPORT = Pattern.compile(
            "^\\s*import\\s+([\\w.]+(?:\\s+as\\s+\\w+)?(?:\\s*,\\s*[\\w.]+(?:\\s+as\\s+\\w+)?){0,50})");
    private static final Pattern PY_FROM = Pattern.compile(
            "^\\s*from\\s+(\\.{0,10}[\\w.]{0,200})\\s+import\\b");

    // JavaScript / TypeScript
    private static final Pattern JS_FROM = Pattern.compile(
            "^\\s*(?:import|export|})[^'\"`;]{0,500}?\\bfrom\\s*['\"]([^'\"]{1,300})['\"]");
    private static final Pattern JS_BARE_IMPORT = Pattern.compile(
            "^\\s*import\\s*['\"]([^'\"]{1,300})['\"]");
    private static final Pattern JS_REQUIRE = Pattern.compile(
            "\\b(?:require|import)\\s*\\(\\s*['\"]([^'\"]{1,300})['\"]\\s*\\)");

    // Go
    private static final Pattern GO_SINGLE = Pattern.compile(
            "^\\s*import\\s+(?:[\\w.]+\\s+)?\"([^\"]{1,300})\"");
    private static final Pattern GO_BLOCK_OPEN = Pattern.compile("^\\s*import\\s*\\(");
    private static final Pattern GO_BLOCK_ENTRY = Pattern.compile(
            "^\\s*(?:[\\w.]+\\s+)?\"([^\"]{1,300})\"");

    // Java
    private static final Pattern JAVA_IMPORT = Pattern.compile(
            "^\\s*import\\s+(?:static\\s+)?([\\w.]+(?:\\.\\*)?)\\s*;");

    // Rust, C, C++, C#
    private static final Pattern RUST_USE = Pattern.compile(
            "^\\s*(?:pub(?:\\([\\w\\s:]{1,40}\\))?\\s+)?use\\s+([^;]{1,300})");
    private static final Pattern RUST_EXTERN = Pattern.compile("^\\s*extern\\s+crate\\s+(\\w+)");
    private static final Pattern C_INCLUDE = Pattern.compile("^\\s*#\\s*include\\s*[<\"]([^>\"]{1,300})[>\"]");
    private static final Pattern CSHARP_USING = Pattern.compile(
            "^\\s*(?:global\\s+)?using\\s+(?:static\\s+)?([\\w.]+)\\s*;");

    private final Language language;

    ImportExtractor(Language language) {
        this.language = language;
    }

    List<ImportRef> extract(List<SourceLine> lines) {
        List<ImportRef> imports = new ArrayList<>();
        boolean inGoBlock = false;

        for (SourceLine line : lines) {
            if (line.comment() || line.code().isBlank()) {
                continue;
            }
            String code = line.code();
            int number = line.number();

            switch (language) {
                case PYTHON -> extractPython(code, number, imports);
                case JAVASCRIPT, TYPESCRIPT -> extractJavaScript(code, number, imports);
                case GO -> inGoBlock = extractGo(code, number, inGoBlock, imports);
                case JAVA -> addFirstGroup(JAVA_IMPORT, code, number, imports);
                case C_FAMILY -> extractCFamily(code, number, imports);
                case UNKNOWN -> {
                    // No import syntax for unknown languages
                }
            }
        }
        return imports;
    }

    private void extractPython(String code, int number, List<ImportRef> imports) {
        Matcher from = PY_FROM.matcher(code);
        if (from.find()) {
            add(from.group(1), number, imports);
            return;
        }
        Matcher plain = PY_IMPORT.matcher(code);
        if (plain.find()) {
            for (String part : plain.group(1).split(",")) {
                String module = part.strip();
                int alias = module.indexOf(" as ");
                if (alias >= 0) {
                    module = module.substring(0, alias).strip();
                }
                add(module, number, imports);
            }
        }
    }

    private void extractJavaScript(String code, int number, List<ImportRef> imports) {
        if (!addFirstGroup(JS_FROM, code, number, imports)) {
            addFirstGroup(JS_BARE_IMPORT, code, number, imports);
        }
        Matcher require = JS_REQUIRE.matcher(code);
        while (require.find()) {
            add(require.group(1), number, imports);
        }
    }

    private boolean extractGo(String code, int number, boolean inBlock, List<ImportRef> imports) {
        if (inBlock) {
            if (code.strip().startsWith(")")) {
                return false;
            }
            addFirstGroup(GO_BLOCK_ENTRY, code, number, imports);
            return true;
        }
        if (GO_BLOCK_OPEN.matcher(code).find()) {
            // Entries may follow the parenthesis on the same line
            String rest = code.substring(code.indexOf('(') + 1);
            addFirstGroup(GO_BLOCK_ENTRY, rest, number, imports);
            return !rest.contains(")");
        }
        addFirstGroup(GO_SINGLE, code, number, imports);
        return false;
    }

    private void extractCFamily(String code, int number, List<ImportRef> imports) {
        if (addFirstGroup(RUST_USE, code, number, imports)) {
            return;
        }
        if (addFirstGroup(RUST_EXTERN, code, number, imports)) {
            return;
        }
        if (addFirstGroup(C_INCLUDE, code, number, imports)) {
            return;
        }
        addFirstGroup(CSHARP_USING, code, number, imports);
    }

    private static boolean addFirstGroup(Pattern pattern, String code, int number, List<ImportRef> imports) {
        Matcher m = pattern.matcher(code);
        if (m.find()) {
            add(m.group(1), number, imports);
            return true;
        }
        return false;
    }

    private static void add(String module, int number, List<ImportRef> imports) {
        if (module != null && !module.isBlank()) {
            imports.add(new ImportRef(module.strip(), number));
        }
    }
}
