package com.phillippitts.actiontracker.service.render;

/** ANSI colour codes for the table renderer; {@link #NONE} renders plain text. */
record ConsoleColors(String green, String red, String blue, String yellow, String reset) {

    static final ConsoleColors ANSI = new ConsoleColors("\u001B[32m", "\u001B[31m", "\u001B[34m", "\u001B[33m", "\u001B[0m");
    static final ConsoleColors NONE = new ConsoleColors("", "", "", "", "");

    static ConsoleColors of(boolean colorize) {
        return colorize ? ANSI : NONE;
    }
}
