package com.elara.kconfig;

/** What a {@link MenuNode} holds. IF nodes only exist while the tree is being built. */
public enum ItemKind {
    SYMBOL,
    CHOICE,
    MENU,
    COMMENT,
    IF
}
