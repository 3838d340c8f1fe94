package com.elara.kconfig;

public enum TokenType {
    // Keywords
    ALLNOCONFIG_Y, BOOL, CHOICE, COMMENT, CONFIG, DEF_BOOL, DEF_TRISTATE, DEFAULT,
    DEFCONFIG_LIST, DEPENDS, ENDCHOICE, ENDIF, ENDMENU, ENV, HELP, HEX, IF, IMPLY, INT,
    MAINMENU, MENU, MENUCONFIG, MODULES, ON, OPTION, OPTIONAL, PROMPT, RANGE, SELECT,
    SOURCE, STRING, TRISTATE, VISIBLE,

    // Operators
    AND, OR, NOT, EQUAL, UNEQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL,
    OPEN_PAREN, CLOSE_PAREN,

    // Operands
    SYMBOL,   // literal holds the Symbol (constant or not)
    TEXT      // raw string: prompts, titles, file names, option arguments
}
