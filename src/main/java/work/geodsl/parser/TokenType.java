package work.geodsl.parser;

enum TokenType {
    IDENTIFIER,
    NUMBER,
    TEXT,
    LEFT_PAREN,
    RIGHT_PAREN,
    LEFT_BRACKET,
    RIGHT_BRACKET,
    COMMA,
    EQUALS,
    MINUS,
    PLUS,
    END
}
