package net.synchro.util;

import java.util.Collection;
import java.util.Iterator;

public final class Formats {

    private Formats() {}

    public static String escapeString(String s) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20 || c == 0x7F) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.toString();
    }

    public static String formatString(String s) {
        if (s == null) return "null";
        return '"' + escapeString(s) + '"';
    }

    public static String formatStrings(Collection<String> items) {
        StringBuilder sb = new StringBuilder("[");
        Iterator<String> it = items.iterator();
        while (it.hasNext()) {
            sb.append(formatString(it.next()));
            if (it.hasNext()) sb.append(", ");
        }
        return sb.append(']').toString();
    }

}
