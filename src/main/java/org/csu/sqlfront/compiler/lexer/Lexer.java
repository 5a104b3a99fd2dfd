package org.csu.sqlfront.compiler.lexer;

import org.csu.sqlfront.common.diagnostic.Diagnostic;
import org.csu.sqlfront.common.diagnostic.Phase;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的SQL文本分解为一系列的Token。遇到非法字符、未闭合的字符串或注释时
 * 记录一条词法错误并继续扫描，保证总能走到 EOF。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    // 关键字映射表 (忽略大小写)
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("select", TokenType.SELECT);
        keywords.put("from", TokenType.FROM);
        keywords.put("where", TokenType.WHERE);
        keywords.put("create", TokenType.CREATE);
        keywords.put("table", TokenType.TABLE);
        keywords.put("insert", TokenType.INSERT);
        keywords.put("into", TokenType.INTO);
        keywords.put("values", TokenType.VALUES);
        keywords.put("delete", TokenType.DELETE);
        keywords.put("update", TokenType.UPDATE);
        keywords.put("set", TokenType.SET);
        keywords.put("int", TokenType.INT);
        keywords.put("float", TokenType.FLOAT);
        keywords.put("text", TokenType.TEXT);
        keywords.put("user", TokenType.USER);
        keywords.put("identified", TokenType.IDENTIFIED);
        keywords.put("by", TokenType.BY);
        keywords.put("grant", TokenType.GRANT);
        keywords.put("on", TokenType.ON);
        keywords.put("to", TokenType.TO);
        keywords.put("and", TokenType.AND);
        keywords.put("or", TokenType.OR);
        keywords.put("not", TokenType.NOT);
    }

    public Lexer(String input) {
        this.input = input == null ? "" : input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token (最后一个总是 EOF) 以及词法错误
     * @return 词法分析结果
     */
    public LexResult tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return new LexResult(tokens, diagnostics);
    }

    /**
     * 获取下一个Token
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        skipWhitespaceAndComments();

        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        // 识别标识符或关键字
        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别字符串
        if (currentChar == '\'') {
            return readString();
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '=':
                return consumeAndReturn(TokenType.EQUAL, "=");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '>':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.GREATER_EQUAL, ">=");
                }
                return consumeAndReturn(TokenType.GREATER, ">");
            case '<':
                if (peekNext() == '>') {
                    return consumeAndReturn(TokenType.NOT_EQUAL, "<>");
                }
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.LESS_EQUAL, "<=");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '!':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.NOT_EQUAL, "!=");
                }
                return readIllegal(currentChar);
            default:
                return readIllegal(currentChar);
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (!isAtEnd() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 检查是否是关键字，忽略大小写
        TokenType type = keywords.getOrDefault(text.toLowerCase(Locale.ROOT), TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (!isAtEnd() && isDigit(peek())) {
            advance();
        }

        // 小数点后面必须还有数字才算小数
        if (!isAtEnd() && peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (!isAtEnd() && isDigit(peek())) {
                advance();
            }
            return new Token(TokenType.DECIMAL_CONST, input.substring(startPos, position), line, startCol);
        }
        return new Token(TokenType.INTEGER_CONST, input.substring(startPos, position), line, startCol);
    }

    private Token readString() {
        int startPos = position;
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的单引号
        while (!isAtEnd() && peek() != '\'') {
            advance();
        }
        if (isAtEnd()) {
            // 未闭合的字符串，剩余输入全部归入这个非法 Token
            diagnostics.add(Diagnostic.error(Phase.LEXICAL, "Unclosed string literal", startLine, startCol));
            return new Token(TokenType.ILLEGAL, input.substring(startPos), startLine, startCol);
        }
        advance(); // 跳过结束的单引号
        return new Token(TokenType.STRING_CONST, input.substring(startPos, position), startLine, startCol);
    }

    private Token readIllegal(char ch) {
        diagnostics.add(Diagnostic.error(Phase.LEXICAL, "Invalid character '" + ch + "'", line, column));
        return consumeAndReturn(TokenType.ILLEGAL, String.valueOf(ch));
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char ch = peek();
            if (Character.isWhitespace(ch)) {
                advance();
            } else if (ch == '-' && peekNext() == '-') {
                // 单行注释: -- 直到行尾
                while (!isAtEnd() && peek() != '\n') {
                    advance();
                }
            } else if (ch == '#' && peekNext() == '#') {
                skipBlockComment();
            } else {
                break;
            }
        }
    }

    // 多行注释: ## ... ##
    private void skipBlockComment() {
        int startLine = line;
        int startCol = column;
        advance();
        advance();
        while (!isAtEnd()) {
            if (peek() == '#' && peekNext() == '#') {
                advance();
                advance();
                return;
            }
            advance();
        }
        diagnostics.add(Diagnostic.error(Phase.LEXICAL, "Unterminated block comment", startLine, startCol));
    }

    private boolean isAtEnd() {
        return position >= input.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        char ch = input.charAt(position++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        for (int i = 0; i < lexeme.length(); i++) {
            advance();
        }
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
