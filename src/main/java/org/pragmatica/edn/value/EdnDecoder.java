package org.pragmatica.edn.value;

import org.pragmatica.edn.reader.EdnReader;
import org.pragmatica.edn.tree.CstNode;
import org.pragmatica.edn.tree.NodeKind;
import org.pragmatica.edn.tree.Nodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Decodes concrete syntax subtrees into {@link EdnValue}s.
 *
 * <p>Whitespace, newlines, comments and discarded forms decode to nothing. Malformed literals,
 * odd map forms and duplicate map keys or set elements also decode to nothing; decoding never throws.
 */
public final class EdnDecoder {
    private static final Logger LOG = LoggerFactory.getLogger(EdnDecoder.class);

    private static final Pattern INT_PATTERN = Pattern.compile(
        "([-+]?)(?:(0)|([1-9][0-9]*)|0[xX]([0-9A-Fa-f]+)|0([0-7]+)|([1-9][0-9]?)[rR]([0-9A-Za-z]+)|0[0-9]+)(N)?");
    private static final Pattern RATIO_PATTERN = Pattern.compile("([-+]?[0-9]+)/([0-9]+)");
    private static final Pattern FLOAT_PATTERN = Pattern.compile("([-+]?[0-9]+(\\.[0-9]*)?([eE][-+]?[0-9]+)?)(M)?");

    private EdnDecoder() {}

    /**
     * Decode a subtree. For a document root, the first significant top-level form is decoded.
     */
    public static Optional<EdnValue> decode(CstNode node) {
        if (Nodes.isInsignificant(node)) {
            return Optional.empty();
        }
        try {
            if (Nodes.isRoot(node)) {
                return significant(node.children()).stream()
                                                   .findFirst()
                                                   .map(EdnDecoder::decodeNode);
            }
            return Optional.of(decodeNode(node));
        } catch (DecodeFailure failure) {
            LOG.debug("Cannot decode '{}' at {}: {}", node.text(), node.span().start(), failure.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Read text and decode its first form.
     */
    public static Optional<EdnValue> readValue(String text) {
        return EdnReader.read(text)
                        .root()
                        .flatMap(EdnDecoder::decode);
    }

    private static EdnValue decodeNode(CstNode node) {
        return switch (node.kind()) {
            case LITERAL -> decodeLiteral(node.text());
            case KEYWORD -> new EdnValue.Keyword(Nodes.keywordName(node)
                                                      .orElseThrow());
            case SYMBOL -> new EdnValue.Symbol(node.text());
            case LIST -> new EdnValue.ListValue(decodeElements(node));
            case VECTOR -> new EdnValue.VectorValue(decodeElements(node));
            case MAP -> decodeMap(node);
            case SET -> decodeSet(node);
            case TAGGED -> decodeTagged(node);
            case QUOTED -> decodeQuoted(node);
            case META -> decodeNode(last(significant(node.children())));
            case ROOT, WHITESPACE, NEWLINE, COMMENT, DISCARD, DELIMITER, TAG ->
                throw new DecodeFailure("no value in " + node.kind());
        };
    }

    private static List<EdnValue> decodeElements(CstNode node) {
        var values = new ArrayList<EdnValue>();
        for (var child : significant(node.children())) {
            values.add(decodeNode(child));
        }
        return values;
    }

    private static EdnValue decodeMap(CstNode node) {
        var values = decodeElements(node);
        if (values.size() % 2 != 0) {
            throw new DecodeFailure("map literal must contain an even number of forms");
        }
        var entries = new LinkedHashMap<EdnValue, EdnValue>();
        for (int i = 0; i < values.size(); i += 2) {
            var key = values.get(i);
            if (entries.containsKey(key)) {
                throw new DecodeFailure("duplicate key: " + key);
            }
            entries.put(key, values.get(i + 1));
        }
        return new EdnValue.MapValue(entries);
    }

    private static EdnValue decodeSet(CstNode node) {
        var values = decodeElements(node);
        var elements = new LinkedHashSet<>(values);
        if (elements.size() != values.size()) {
            throw new DecodeFailure("duplicate element in set literal");
        }
        return new EdnValue.SetValue(elements);
    }

    private static EdnValue decodeTagged(CstNode node) {
        var parts = significant(node.children());
        var tag = parts.get(0).text().substring(1);
        return new EdnValue.Tagged(tag, decodeNode(last(parts)));
    }

    private static EdnValue decodeQuoted(CstNode node) {
        var prefix = node.children().get(0).text();
        var operator = switch (prefix) {
            case "'" -> "quote";
            case "`" -> "syntax-quote";
            case "~" -> "clojure.core/unquote";
            case "~@" -> "clojure.core/unquote-splicing";
            case "@" -> "clojure.core/deref";
            case "#'" -> "var";
            default -> throw new DecodeFailure("unknown reader macro " + prefix);
        };
        return EdnValue.list(new EdnValue.Symbol(operator), decodeNode(last(significant(node.children()))));
    }

    private static EdnValue decodeLiteral(String text) {
        switch (text) {
            case "nil":
                return EdnValue.NIL;
            case "true":
                return new EdnValue.Bool(true);
            case "false":
                return new EdnValue.Bool(false);
            default:
                break;
        }
        char first = text.charAt(0);
        if (first == '"') {
            return new EdnValue.Str(unescape(text.substring(1, text.length() - 1)));
        }
        if (first == '\\') {
            return new EdnValue.Char(decodeCharacter(text.substring(1)));
        }
        if (text.startsWith("##")) {
            return decodeSymbolicValue(text);
        }
        if (text.startsWith("#\"")) {
            return decodeRegex(text.substring(2, text.length() - 1));
        }
        return decodeNumber(text);
    }

    private static EdnValue decodeSymbolicValue(String text) {
        return switch (text) {
            case "##Inf" -> new EdnValue.Real(Double.POSITIVE_INFINITY);
            case "##-Inf" -> new EdnValue.Real(Double.NEGATIVE_INFINITY);
            case "##NaN" -> new EdnValue.Real(Double.NaN);
            default -> throw new DecodeFailure("unknown symbolic value " + text);
        };
    }

    private static EdnValue decodeRegex(String pattern) {
        try {
            Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new DecodeFailure("invalid regex: " + e.getDescription());
        }
        return new EdnValue.Regex(pattern);
    }

    private static EdnValue decodeNumber(String text) {
        var intMatch = INT_PATTERN.matcher(text);
        if (intMatch.matches()) {
            return new EdnValue.Int(decodeInteger(intMatch));
        }
        var ratioMatch = RATIO_PATTERN.matcher(text);
        if (ratioMatch.matches()) {
            return decodeRatio(new BigInteger(ratioMatch.group(1)), new BigInteger(ratioMatch.group(2)));
        }
        var floatMatch = FLOAT_PATTERN.matcher(text);
        if (floatMatch.matches()) {
            if (floatMatch.group(4) != null) {
                return new EdnValue.Decimal(new BigDecimal(floatMatch.group(1)));
            }
            return new EdnValue.Real(Double.parseDouble(floatMatch.group(1)));
        }
        throw new DecodeFailure("invalid number: " + text);
    }

    private static BigInteger decodeInteger(Matcher match) {
        BigInteger magnitude;
        if (match.group(2) != null) {
            magnitude = BigInteger.ZERO;
        } else if (match.group(3) != null) {
            magnitude = new BigInteger(match.group(3));
        } else if (match.group(4) != null) {
            magnitude = new BigInteger(match.group(4), 16);
        } else if (match.group(5) != null) {
            magnitude = new BigInteger(match.group(5), 8);
        } else if (match.group(7) != null) {
            magnitude = parseRadix(match.group(7), Integer.parseInt(match.group(6)));
        } else {
            throw new DecodeFailure("invalid number: " + match.group());
        }
        return "-".equals(match.group(1)) ? magnitude.negate() : magnitude;
    }

    private static BigInteger parseRadix(String digits, int radix) {
        if (radix < Character.MIN_RADIX || radix > Character.MAX_RADIX) {
            throw new DecodeFailure("radix out of range: " + radix);
        }
        try {
            return new BigInteger(digits, radix);
        } catch (NumberFormatException e) {
            throw new DecodeFailure("invalid digits for radix " + radix + ": " + digits);
        }
    }

    private static EdnValue decodeRatio(BigInteger numerator, BigInteger denominator) {
        if (denominator.signum() == 0) {
            throw new DecodeFailure("divide by zero");
        }
        var gcd = numerator.gcd(denominator);
        var num = numerator.divide(gcd);
        var den = denominator.divide(gcd);
        if (den.equals(BigInteger.ONE)) {
            return new EdnValue.Int(num);
        }
        return new EdnValue.Ratio(num, den);
    }

    private static char decodeCharacter(String token) {
        if (token.length() == 1) {
            return token.charAt(0);
        }
        switch (token) {
            case "newline":
                return '\n';
            case "space":
                return ' ';
            case "tab":
                return '\t';
            case "backspace":
                return '\b';
            case "formfeed":
                return '\f';
            case "return":
                return '\r';
            default:
                break;
        }
        if (token.length() == 5 && token.charAt(0) == 'u') {
            return (char) parseCode(token.substring(1), 16);
        }
        if (token.length() >= 2 && token.length() <= 4 && token.charAt(0) == 'o') {
            int code = parseCode(token.substring(1), 8);
            if (code > 0377) {
                throw new DecodeFailure("octal escape out of range: " + token);
            }
            return (char) code;
        }
        throw new DecodeFailure("unsupported character: \\" + token);
    }

    private static String unescape(String body) {
        var sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (i >= body.length()) {
                throw new DecodeFailure("dangling escape");
            }
            char escaped = body.charAt(i++);
            switch (escaped) {
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case 'n' -> sb.append('\n');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '\\' -> sb.append('\\');
                case '"' -> sb.append('"');
                case 'u' -> {
                    if (i + 4 > body.length()) {
                        throw new DecodeFailure("invalid unicode escape");
                    }
                    sb.append((char) parseCode(body.substring(i, i + 4), 16));
                    i += 4;
                }
                default -> {
                    if (escaped < '0' || escaped > '7') {
                        throw new DecodeFailure("unsupported escape character: \\" + escaped);
                    }
                    int end = i - 1;
                    while (end < body.length() && end < i + 2 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
                        end++;
                    }
                    int code = parseCode(body.substring(i - 1, end), 8);
                    if (code > 0377) {
                        throw new DecodeFailure("octal escape out of range");
                    }
                    sb.append((char) code);
                    i = end;
                }
            }
        }
        return sb.toString();
    }

    private static int parseCode(String digits, int radix) {
        int code = 0;
        for (int i = 0; i < digits.length(); i++) {
            int digit = Character.digit(digits.charAt(i), radix);
            if (digit < 0) {
                throw new DecodeFailure("invalid escape digits: " + digits);
            }
            code = code * radix + digit;
        }
        return code;
    }

    private static List<CstNode> significant(List<CstNode> children) {
        return children.stream()
                       .filter(child -> !Nodes.isInsignificant(child) && !child.is(NodeKind.DELIMITER))
                       .toList();
    }

    private static CstNode last(List<CstNode> nodes) {
        return nodes.get(nodes.size() - 1);
    }

    private static final class DecodeFailure extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private DecodeFailure(String message) {
            super(message, null, false, false);
        }
    }
}
