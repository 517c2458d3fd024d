package io.pqcscan.detectors;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled form of a {@link MatcherSpec}.
 * <p>
 * Every expression is vetted before compilation. Refused are unbounded
 * wildcards ({@code .*}, {@code .+}), repeated groups that contain a repetition
 * or an alternation, and unbounded repetitions that directly follow another
 * unbounded repetition. At match time each expression gets a step budget
 * proportional to the line length; exceeding it aborts the match with
 * {@link StepLimitExceededException}.
 */
public final class LineMatcher {

    /**
     * Character reads allowed per character of examined text, per expression.
     */
    static final int STEPS_PER_CHAR = 1024;

    /**
     * Start and end offsets of a match within the examined text.
     */
    public record Match(int start, int end) {
    }

    private final MatcherKind kind;
    private final List<Pattern> patterns;

    private LineMatcher(MatcherKind kind, List<Pattern> patterns) {
        this.kind = kind;
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Vets and compiles the matcher of a pattern.
     *
     * @throws DetectionException if an expression is missing, invalid or unsafe
     */
    public static LineMatcher compile(String patternId, MatcherSpec spec) throws DetectionException {
        if (spec.regexes().isEmpty()) {
            throw new DetectionException(patternId, "matcher has no regex");
        }
        int flags = spec.caseInsensitive() ? Pattern.CASE_INSENSITIVE : 0;
        List<Pattern> compiled = new ArrayList<>();
        for (String regex : spec.regexes()) {
            if (regex == null || regex.isEmpty()) {
                throw new DetectionException(patternId, "empty regex");
            }
            String problem = unsafeConstruct(regex);
            if (problem != null) {
                throw new DetectionException(patternId, problem + " in regex: " + regex);
            }
            try {
                compiled.add(Pattern.compile(regex, flags));
            } catch (PatternSyntaxException e) {
                throw new DetectionException(patternId, "invalid regex: " + e.getDescription(), e);
            }
        }
        return new LineMatcher(spec.kind(), compiled);
    }

    public MatcherKind kind() {
        return kind;
    }

    /**
     * Returns the earliest match of any expression in the text.
     *
     * @throws StepLimitExceededException if an expression exceeds its step budget
     */
    public Optional<Match> firstMatch(CharSequence text) {
        long budget = (long) STEPS_PER_CHAR * (text.length() + 1);
        Match best = null;
        for (Pattern pattern : patterns) {
            Matcher m = pattern.matcher(new BudgetedText(text, budget));
            if (m.find() && (best == null || m.start() < best.start())) {
                best = new Match(m.start(), m.end());
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Returns a description of the first unsafe construct in the expression,
     * or null if it is acceptable. Syntax errors are left to {@link Pattern#compile}.
     */
    static String unsafeConstruct(String regex) {
        Deque<Group> groups = new ArrayDeque<>();
        // True while the last consumed atom repeats without bound
        boolean trailingUnbounded = false;
        int n = regex.length();
        int i = 0;
        while (i < n) {
            char ch = regex.charAt(i);
            if (ch == '(') {
                groups.push(new Group(trailingUnbounded));
                i = skipGroupPrefix(regex, i + 1);
                continue;
            }
            if (ch == ')') {
                if (groups.isEmpty()) {
                    return null;
                }
                Group group = groups.pop();
                Quantifier q = Quantifier.at(regex, i + 1);
                if (q.repeats() && group.repeated) {
                    return "nested repetition";
                }
                if (q.repeats() && group.alternation) {
                    return "repeated alternation";
                }
                if (q.unbounded() && group.unboundedBefore) {
                    return "adjacent unbounded repetition";
                }
                if ((group.repeated || q.repeats()) && !groups.isEmpty()) {
                    groups.peek().repeated = true;
                }
                boolean tail = trailingUnbounded || group.branchUnbounded;
                if (q.unbounded()) {
                    trailingUnbounded = true;
                } else if (q.optional()) {
                    trailingUnbounded = tail || group.unboundedBefore;
                } else {
                    trailingUnbounded = tail;
                }
                i = i + 1 + q.length();
                continue;
            }
            if (ch == '|') {
                if (groups.isEmpty()) {
                    trailingUnbounded = false;
                } else {
                    Group group = groups.peek();
                    group.alternation = true;
                    group.branchUnbounded |= trailingUnbounded;
                    trailingUnbounded = group.unboundedBefore;
                }
                i++;
                continue;
            }
            if (ch == '^' || ch == '$') {
                i++;
                continue;
            }

            int end = atomEnd(regex, i);
            if (end < 0) {
                return null;
            }
            Quantifier q = Quantifier.at(regex, end);
            if (ch == '.' && q.unbounded()) {
                return "unbounded wildcard";
            }
            if (q.unbounded() && trailingUnbounded) {
                return "adjacent unbounded repetition";
            }
            if (q.repeats() && !groups.isEmpty()) {
                groups.peek().repeated = true;
            }
            if (q.unbounded()) {
                trailingUnbounded = true;
            } else if (!q.optional() && !isZeroWidth(regex, i)) {
                trailingUnbounded = false;
            }
            i = end + q.length();
        }
        return null;
    }

    private static final class Group {
        final boolean unboundedBefore;
        boolean repeated;
        boolean alternation;
        boolean branchUnbounded;

        Group(boolean unboundedBefore) {
            this.unboundedBefore = unboundedBefore;
        }
    }

    /**
     * Repetition suffix of an atom or group.
     *
     * @param length    Characters taken by the quantifier, 0 if none
     * @param min       Minimum repetitions
     * @param max       Maximum repetitions, -1 if unbounded
     */
    private record Quantifier(int length, int min, int max) {

        static final Quantifier NONE = new Quantifier(0, 1, 1);

        static Quantifier at(String regex, int index) {
            if (index >= regex.length()) {
                return NONE;
            }
            Quantifier q = switch (regex.charAt(index)) {
                case '*' -> new Quantifier(1, 0, -1);
                case '+' -> new Quantifier(1, 1, -1);
                case '?' -> new Quantifier(1, 0, 1);
                case '{' -> braces(regex, index);
                default -> NONE;
            };
            int next = index + q.length;
            if (q.length > 0 && next < regex.length()
                    && (regex.charAt(next) == '?' || regex.charAt(next) == '+')) {
                return new Quantifier(q.length + 1, q.min, q.max);
            }
            return q;
        }

        private static Quantifier braces(String regex, int open) {
            int close = regex.indexOf('}', open);
            if (close < 0) {
                return NONE;
            }
            String body = regex.substring(open + 1, close);
            if (!body.matches("\\d{1,9}(?:,\\d{0,9})?")) {
                return NONE;
            }
            int comma = body.indexOf(',');
            int length = close - open + 1;
            if (comma < 0) {
                int count = Integer.parseInt(body);
                return new Quantifier(length, count, count);
            }
            int min = Integer.parseInt(body.substring(0, comma));
            String upper = body.substring(comma + 1);
            return new Quantifier(length, min, upper.isEmpty() ? -1 : Integer.parseInt(upper));
        }

        boolean unbounded() {
            return length > 0 && max < 0;
        }

        boolean repeats() {
            return unbounded() || max > 1;
        }

        boolean optional() {
            return length > 0 && min == 0;
        }
    }

    private static int skipGroupPrefix(String regex, int index) {
        int n = regex.length();
        if (index >= n || regex.charAt(index) != '?') {
            return index;
        }
        int j = index + 1;
        if (j >= n) {
            return j;
        }
        char c = regex.charAt(j);
        if (c == ':' || c == '=' || c == '!' || c == '>') {
            return j + 1;
        }
        if (c == '<') {
            if (j + 1 < n && (regex.charAt(j + 1) == '=' || regex.charAt(j + 1) == '!')) {
                return j + 2;
            }
            int close = regex.indexOf('>', j);
            return close < 0 ? n : close + 1;
        }
        // Inline flags: (?i) ends at ')', (?i:...) opens a group
        while (j < n && regex.charAt(j) != ':' && regex.charAt(j) != ')') {
            j++;
        }
        return j < n && regex.charAt(j) == ':' ? j + 1 : j;
    }

    /**
     * Returns the index just past the atom starting at {@code index}, or -1
     * if the atom is not terminated.
     */
    private static int atomEnd(String regex, int index) {
        int n = regex.length();
        char ch = regex.charAt(index);
        if (ch == '\\') {
            if (index + 1 >= n) {
                return -1;
            }
            char escaped = regex.charAt(index + 1);
            if ((escaped == 'p' || escaped == 'P') && index + 2 < n && regex.charAt(index + 2) == '{') {
                int close = regex.indexOf('}', index);
                return close < 0 ? -1 : close + 1;
            }
            if (escaped == 'Q') {
                int close = regex.indexOf("\\E", index + 2);
                return close < 0 ? n : close + 2;
            }
            if (escaped == 'x') {
                return Math.min(n, index + 4);
            }
            if (escaped == 'u') {
                return Math.min(n, index + 6);
            }
            return index + 2;
        }
        if (ch == '[') {
            return classEnd(regex, index);
        }
        return index + 1;
    }

    private static int classEnd(String regex, int open) {
        int n = regex.length();
        int j = open + 1;
        // A leading ']' or '^]' is a literal member
        if (j < n && regex.charAt(j) == '^') {
            j++;
        }
        if (j < n && regex.charAt(j) == ']') {
            j++;
        }
        int depth = 1;
        while (j < n) {
            char c = regex.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                return j + 1;
            }
            j++;
        }
        return -1;
    }

    private static boolean isZeroWidth(String regex, int index) {
        return regex.charAt(index) == '\\' && index + 1 < regex.length()
                && "bBAGzZ".indexOf(regex.charAt(index + 1)) >= 0;
    }

    /**
     * Thrown when an expression reads more characters than its budget allows.
     */
    public static final class StepLimitExceededException extends RuntimeException {

        StepLimitExceededException(int textLength) {
            super("match step limit exceeded on " + textLength + " characters");
        }
    }

    /**
     * Text view that counts character reads against a budget.
     */
    private static final class BudgetedText implements CharSequence {

        private final CharSequence text;
        private long remaining;

        BudgetedText(CharSequence text, long budget) {
            this.text = text;
            this.remaining = budget;
        }

        @Override
        public int length() {
            return text.length();
        }

        @Override
        public char charAt(int index) {
            if (--remaining < 0) {
                throw new StepLimitExceededException(text.length());
            }
            return text.charAt(index);
        }

        @Override
        public CharSequence subSequence(int start, int end) {
            return text.subSequence(start, end);
        }

        @Override
        public String toString() {
            return text.toString();
        }
    }
}
