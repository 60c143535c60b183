package work.isu.core.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import work.isu.core.diag.IsuParseException;
import work.isu.core.diag.SourcePos;
import work.isu.core.model.BinaryOp;
import work.isu.core.model.Expr;
import work.isu.core.model.StdFunction;

/**
 * Single-pass reader for prefix expressions: {@code (tag operand...)}, bare literals and bare
 * variable names. There is no precedence to resolve; the tag fixes each node's shape.
 */
public final class SExprReader {
    static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

    private enum TokenType {
        OPEN,
        CLOSE,
        STRING,
        ATOM
    }

    private record Token(TokenType type, String text, SourcePos pos) {}

    private final List<Token> tokens;
    private final SourcePos end;
    private int index = 0;

    private SExprReader(List<Token> tokens, SourcePos end) {
        this.tokens = tokens;
        this.end = end;
    }

    /** Parses exactly one expression from {@code text}, which starts at {@code start}. */
    public static Expr parse(String text, SourcePos start) {
        var reader = new SExprReader(tokenize(text, start), start.shift(text.length()));
        if (reader.tokens.isEmpty()) {
            throw new IsuParseException(start, "missing expression");
        }
        Expr expr = reader.readOperand();
        if (reader.index < reader.tokens.size()) {
            throw new IsuParseException(reader.tokens.get(reader.index).pos(), "unexpected tokens after expression");
        }
        return expr;
    }

    /** Parses a single literal atom such as {@code 0}, {@code "text"}, {@code true} or {@code []}. */
    public static Expr.Const parseLiteral(String text, SourcePos start) {
        var tokens = tokenize(text, start);
        if (tokens.size() != 1) {
            throw new IsuParseException(start, "expected a single literal but got '" + text + "'");
        }
        var literal = literal(tokens.get(0));
        if (literal == null) {
            throw new IsuParseException(start, "expected a literal but got '" + text + "'");
        }
        return literal;
    }

    public static boolean isIdentifier(String text) {
        return text != null && IDENTIFIER.matcher(text).matches();
    }

    private Expr readOperand() {
        Token token = next();
        switch (token.type()) {
            case OPEN:
                return readTagged(token);
            case CLOSE:
                throw new IsuParseException(token.pos(), "unexpected ')'");
            case STRING:
                return Expr.Const.ofString(token.text());
            default:
                var literal = literal(token);
                if (literal != null) {
                    return literal;
                }
                if (isIdentifier(token.text())) {
                    return new Expr.Var(token.text());
                }
                throw new IsuParseException(token.pos(), "invalid operand '" + token.text() + "'");
        }
    }

    private Expr readTagged(Token open) {
        Token tagToken = next();
        if (tagToken.type() != TokenType.ATOM) {
            throw new IsuParseException(tagToken.pos(), "expected an expression tag after '('");
        }
        String tag = tagToken.text().toLowerCase(Locale.ROOT);
        Expr result;
        switch (tag) {
            case "const": {
                Token value = next();
                var literal = value.type() == TokenType.STRING ? Expr.Const.ofString(value.text()) : literal(value);
                if (literal == null) {
                    throw new IsuParseException(value.pos(), "const expects a literal but got '" + value.text() + "'");
                }
                result = literal;
                break;
            }
            case "var": {
                Token name = next();
                if (name.type() != TokenType.ATOM || !isIdentifier(name.text()) || literal(name) != null) {
                    throw new IsuParseException(name.pos(), "var expects a variable name but got '" + name.text() + "'");
                }
                result = new Expr.Var(name.text());
                break;
            }
            case "index": {
                Expr target = readOperandOrFail(tag);
                Expr position = readOperandOrFail(tag);
                result = new Expr.Index(target, position);
                break;
            }
            case "call": {
                Token name = next();
                if (name.type() != TokenType.ATOM) {
                    throw new IsuParseException(name.pos(), "call expects a function name");
                }
                var function = StdFunction.fromName(name.text())
                    .orElseThrow(() -> new IsuParseException(name.pos(), "unknown standard function '" + name.text() + "'"));
                var args = new ArrayList<Expr>();
                while (peekType() != TokenType.CLOSE) {
                    if (peekType() == null) {
                        throw new IsuParseException(end, "unterminated call to " + function.name());
                    }
                    args.add(readOperand());
                }
                result = new Expr.Call(function, args);
                break;
            }
            default: {
                var op = BinaryOp.fromTag(tag)
                    .orElseThrow(() -> new IsuParseException(tagToken.pos(), "unknown expression tag '" + tagToken.text() + "'"));
                Expr left = readOperandOrFail(tag);
                Expr right = readOperandOrFail(tag);
                result = new Expr.Binary(op, left, right);
                break;
            }
        }
        Token close = index < tokens.size() ? tokens.get(index) : null;
        if (close == null) {
            throw new IsuParseException(end, "missing ')' for '" + tag + "' opened at " + open.pos());
        }
        if (close.type() != TokenType.CLOSE) {
            throw new IsuParseException(close.pos(), "too many operands for '" + tag + "'");
        }
        index++;
        return result;
    }

    private Expr readOperandOrFail(String tag) {
        if (peekType() == TokenType.CLOSE) {
            throw new IsuParseException(tokens.get(index).pos(), "too few operands for '" + tag + "'");
        }
        return readOperand();
    }

    private TokenType peekType() {
        return index < tokens.size() ? tokens.get(index).type() : null;
    }

    private Token next() {
        if (index >= tokens.size()) {
            throw new IsuParseException(end, "unexpected end of expression");
        }
        return tokens.get(index++);
    }

    private static Expr.Const literal(Token token) {
        if (token.type() == TokenType.STRING) {
            return Expr.Const.ofString(token.text());
        }
        if (token.type() != TokenType.ATOM) {
            return null;
        }
        String text = token.text();
        if (INTEGER.matcher(text).matches()) {
            try {
                return Expr.Const.ofInt(Long.parseLong(text));
            } catch (NumberFormatException ex) {
                throw new IsuParseException(token.pos(), "integer literal out of range: " + text);
            }
        }
        if ("true".equalsIgnoreCase(text)) {
            return Expr.Const.ofBool(true);
        }
        if ("false".equalsIgnoreCase(text)) {
            return Expr.Const.ofBool(false);
        }
        if ("[]".equals(text)) {
            return Expr.Const.emptyList();
        }
        if ("{}".equals(text)) {
            return Expr.Const.emptyMap();
        }
        return null;
    }

    private static List<Token> tokenize(String text, SourcePos start) {
        var tokens = new ArrayList<Token>();
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            SourcePos pos = start.shift(i);
            if (ch == '(' || ch == ')') {
                tokens.add(new Token(ch == '(' ? TokenType.OPEN : TokenType.CLOSE, String.valueOf(ch), pos));
                i++;
                continue;
            }
            if (ch == '"') {
                var value = new StringBuilder();
                int j = i + 1;
                boolean closed = false;
                while (j < text.length()) {
                    char c = text.charAt(j);
                    if (c == '\\') {
                        if (j + 1 >= text.length()) {
                            break;
                        }
                        value.append(unescape(text.charAt(j + 1), start.shift(j)));
                        j += 2;
                        continue;
                    }
                    if (c == '"') {
                        closed = true;
                        break;
                    }
                    value.append(c);
                    j++;
                }
                if (!closed) {
                    throw new IsuParseException(pos, "unterminated string literal");
                }
                tokens.add(new Token(TokenType.STRING, value.toString(), pos));
                i = j + 1;
                continue;
            }
            int j = i;
            while (j < text.length() && !Character.isWhitespace(text.charAt(j)) && text.charAt(j) != '(' && text.charAt(j) != ')') {
                j++;
            }
            tokens.add(new Token(TokenType.ATOM, text.substring(i, j), pos));
            i = j;
        }
        return tokens;
    }

    private static char unescape(char escaped, SourcePos pos) {
        switch (escaped) {
            case '"':
                return '"';
            case '\\':
                return '\\';
            case 'n':
                return '\n';
            case 't':
                return '\t';
            default:
                throw new IsuParseException(pos, "illegal escape '\\" + escaped + "'");
        }
    }
}
