package com.maxdemarzi.kmap.parser;

public enum Fixity {
    PREFIX,
    POSTFIX,
    INFIX
}
