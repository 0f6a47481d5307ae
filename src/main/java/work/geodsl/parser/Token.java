package work.geodsl.parser;

record Token(TokenType type, String text, int position) {
    boolean is(TokenType candidate) {
        return type == candidate;
    }

    String describe() {
        return type == TokenType.END ? "end of input" : "'" + text + "'";
    }
}
