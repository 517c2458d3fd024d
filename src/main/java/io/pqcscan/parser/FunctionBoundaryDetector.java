package io.pqcscan.parser;

import io.pqcscan.model.Language;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic function boundary detection.
 * <p>
 * Python bodies end at the first code line indented no deeper than the header;
 * every other known language is tracked by brace depth on comment- and
 * string-free text. Nested functions are folded into their outermost parent,
 * so the result is always ordered and non-overlapping. A wrong guess only
 * produces a wrong boundary, never an exception.
 */
class FunctionBoundaryDetector {

    private static final Pattern PY_DEF = Pattern.compile("^\\s*(?:async\\s+)?def\\s+(\\w+)\\s*\\(");

    private static final Pattern JS_FUNCTION = Pattern.compile(
            "\\bfunction\\s*\\*?\\s*([\\w$]+)\\s*\\(");
    private static final Pattern JS_ASSIGNED_FUNCTION = Pattern.compile(
            "\\b(?:const|let|var)\\s+([\\w$]+)\\s*(?::[^=]{1,80})?=\\s*(?:async\\s+)?(?:function\\b|\\([^()]{0,200}\\)\\s*(?::\\s*[\\w<>\\[\\]|, ]{1,80})?=>|[\\w$]+\\s*=>)");
    private static final Pattern JS_METHOD = Pattern.compile(
            "^\\s*(?:(?:public|private|protected|static|async|readonly|override|get|set)\\s+){0,4}([\\w$]+)\\s*\\([^()]{0,300}\\)\\s*(?::\\s*[^{;]{1,120})?\\{");

    private static final Pattern GO_FUNC = Pattern.compile(
            "^\\s*func\\s+(?:\\([^)]{0,120}\\)\\s*)?(\\w+)\\s*[\\[(]");

    private static final Pattern RUST_FN = Pattern.compile(
            "^\\s*(?:pub(?:\\([\\w\\s:]{1,40}\\))?\\s+)?(?:(?:const|async|unsafe)\\s+){0,3}(?:extern\\s+\"\\w+\"\\s+)?fn\\s+(\\w+)");

    private static final Pattern TYPED_METHOD = Pattern.compile(
            "^\\s*(?:@\\w+(?:\\([^)]{0,120}\\))?\\s+){0,3}(?:[\\w<>\\[\\],.?*&:]+\\s+){1,8}\\**&?(\\w+)\\s*\\(");

    private static final Set<String> NOT_FUNCTION_NAMES = Set.of(
            "if", "for", "while", "switch", "catch", "return", "new", "throw", "else",
            "case", "do", "try", "synchronized", "sizeof", "typeof", "await", "yield",
            "using", "lock", "foreach", "function", "elif", "with");

    private static final Set<String> NOT_DECLARATION_STARTS = Set.of(
            "return", "new", "throw", "else", "case", "await", "yield", "delete", "goto");

    /** How many lines after a brace-language header may hold its opening brace. */
    private static final int BRACE_LOOKAHEAD = 3;

    private final Language language;

    FunctionBoundaryDetector(Language language) {
        this.language = language;
    }

    List<FunctionInfo> detect(List<SourceLine> lines) {
        return switch (language) {
            case PYTHON -> detectIndented(lines);
            case JAVASCRIPT, TYPESCRIPT, GO, JAVA, C_FAMILY -> detectBraced(lines);
            case UNKNOWN -> List.of();
        };
    }

    private List<FunctionInfo> detectIndented(List<SourceLine> lines) {
        List<FunctionInfo> functions = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            SourceLine header = lines.get(i);
            Matcher m = header.comment() ? null : PY_DEF.matcher(header.code());
            if (m == null || !m.find()) {
                i++;
                continue;
            }
            int endIndex = i;
            int j = i + 1;
            while (j < lines.size()) {
                SourceLine candidate = lines.get(j);
                if (candidate.blank() || candidate.comment()) {
                    j++;
                    continue;
                }
                if (candidate.indent() <= header.indent() && !isContinuation(lines, j)) {
                    break;
                }
                endIndex = j;
                j++;
            }
            functions.add(new FunctionInfo(m.group(1), header.number(), lines.get(endIndex).number()));
            i = endIndex + 1;
        }
        return functions;
    }

    /**
     * Treats a dedented line as part of the body when the previous code line
     * leaves a bracket open, e.g. a multi-line argument list.
     */
    private boolean isContinuation(List<SourceLine> lines, int index) {
        for (int k = index - 1; k >= 0; k--) {
            SourceLine previous = lines.get(k);
            if (previous.blank() || previous.comment()) {
                continue;
            }
            String structure = previous.structure().stripTrailing();
            return structure.endsWith("(") || structure.endsWith("[") || structure.endsWith(",")
                    || structure.endsWith("\\");
        }
        return false;
    }

    private List<FunctionInfo> detectBraced(List<SourceLine> lines) {
        List<FunctionInfo> functions = new ArrayList<>();
        int i = 0;
        while (i < lines.size()) {
            SourceLine header = lines.get(i);
            String name = header.comment() ? null : matchHeader(header.structure(), header.code());
            if (name == null) {
                i++;
                continue;
            }
            int end = findBraceBodyEnd(lines, i);
            if (end < 0) {
                i++;
                continue;
            }
            functions.add(new FunctionInfo(name, header.number(), lines.get(end).number()));
            i = end + 1;
        }
        return functions;
    }

    /**
     * Returns the index of the line closing the body that opens at or shortly
     * after {@code headerIndex}, or -1 if the header is only a declaration.
     */
    private int findBraceBodyEnd(List<SourceLine> lines, int headerIndex) {
        int depth = 0;
        boolean opened = false;
        for (int j = headerIndex; j < lines.size(); j++) {
            String structure = lines.get(j).structure();
            for (int c = 0; c < structure.length(); c++) {
                char ch = structure.charAt(c);
                if (!opened) {
                    if (ch == ';') {
                        return -1;
                    }
                    if (ch == '{') {
                        opened = true;
                        depth = 1;
                    }
                    continue;
                }
                if (ch == '{') {
                    depth++;
                } else if (ch == '}') {
                    depth--;
                    if (depth == 0) {
                        return j;
                    }
                }
            }
            if (!opened && j - headerIndex >= BRACE_LOOKAHEAD) {
                return -1;
            }
        }
        return opened ? lines.size() - 1 : -1;
    }

    private String matchHeader(String structure, String code) {
        String stripped = structure.strip();
        if (stripped.isEmpty()) {
            return null;
        }
        String firstWord = stripped.split("[^\\w$]", 2)[0];
        if (NOT_DECLARATION_STARTS.contains(firstWord)) {
            return null;
        }
        return switch (language) {
            case JAVASCRIPT, TYPESCRIPT -> firstName(code, JS_FUNCTION, JS_ASSIGNED_FUNCTION, JS_METHOD);
            case GO -> firstName(code, GO_FUNC);
            case JAVA -> stripped.endsWith(";") ? null : firstName(code, TYPED_METHOD);
            case C_FAMILY -> stripped.endsWith(";") ? null : firstName(code, RUST_FN, TYPED_METHOD);
            default -> null;
        };
    }

    private static String firstName(String code, Pattern... patterns) {
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(code);
            if (m.find()) {
                String name = m.group(1);
                if (!NOT_FUNCTION_NAMES.contains(name)) {
                    return name;
                }
            }
        }
        return null;
    }
}
