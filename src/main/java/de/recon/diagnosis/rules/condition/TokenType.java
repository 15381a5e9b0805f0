package de.recon.diagnosis.rules.condition;

enum TokenType {
    IDENTIFIER,
    STRING,
    NUMBER,
    EQ,
    NE,
    LPAREN,
    RPAREN,
    AND,
    OR,
    NOT,
    IS,
    NONE,
    TRUE,
    FALSE,
    EOF
}
