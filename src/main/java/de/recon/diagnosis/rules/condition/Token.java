package de.recon.diagnosis.rules.condition;

record Token(TokenType type, String text, int position) {

    boolean is(TokenType t) {
        return type == t;
    }
}
