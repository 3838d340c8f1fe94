package com.elara.kconfig;

import java.util.ArrayList;
import java.util.List;

/**
 * Feeds the lines of one Kconfig file. Lines keep their trailing newline.
 * {@link #next()} joins lines ending in a backslash; the line number always
 * refers to the last physical line consumed.
 */
final class LineFeed {
    private final String filename;
    private final List<String> lines;
    private int linenr = 0;

    LineFeed(String filename, String contents) {
        this.filename = filename;
        this.lines = splitLines(contents);
    }

    String getFilename() { return filename; }

    int getLinenr() { return linenr; }

    /** Next logical line, or null at end of file. */
    String next() {
        if (linenr >= lines.size()) return null;
        String line = lines.get(linenr++);
        while (line.endsWith("\\\n") && linenr < lines.size()) {
            line = line.substring(0, line.length() - 2) + lines.get(linenr++);
        }
        return line;
    }

    /** Next physical line, without continuation handling. Used for help text. */
    String nextNoJoin() {
        if (linenr >= lines.size()) return null;
        return lines.get(linenr++);
    }

    /** Pushes the last physical line back. */
    void unget() {
        linenr--;
    }

    private static List<String> splitLines(String contents) {
        String s = contents.replace("\r\n", "\n");
        List<String> res = new ArrayList<>();
        int start = 0;
        while (start < s.length()) {
            int nl = s.indexOf('\n', start);
            if (nl < 0) {
                res.add(s.substring(start));
                break;
            }
            res.add(s.substring(start, nl + 1));
            start = nl + 1;
        }
        return res;
    }
}
