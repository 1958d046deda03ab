package com.keywatch.shared.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public record GroupRule(List<String> whitelist, List<String> blacklist) {

    public enum ListKind {
        WHITELIST, BLACKLIST;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public GroupRule {
        whitelist = List.copyOf(whitelist);
        blacklist = List.copyOf(blacklist);
    }

    public static GroupRule empty() {
        return new GroupRule(List.of(), List.of());
    }

    public List<String> list(ListKind kind) {
        return kind == ListKind.WHITELIST ? whitelist : blacklist;
    }

    public GroupRule withList(ListKind kind, List<String> entries) {
        return kind == ListKind.WHITELIST
                ? new GroupRule(entries, blacklist)
                : new GroupRule(whitelist, entries);
    }

    public GroupRule withEntry(ListKind kind, String entry) {
        var entries = new ArrayList<>(list(kind));
        entries.add(entry);
        return withList(kind, entries);
    }

    /** Entries match a chat by exact numeric id or by display name ignoring case. */
    public static boolean matches(String entry, long chatId, String chatName) {
        var value = entry.strip();
        if (value.equals(String.valueOf(chatId))) return true;
        return chatName != null && value.equalsIgnoreCase(chatName.strip());
    }

    public static int indexOf(List<String> entries, String entry) {
        for (int i = 0; i < entries.size(); i++) {
            if (entries.get(i).equalsIgnoreCase(entry.strip())) return i;
        }
        return -1;
    }
}
