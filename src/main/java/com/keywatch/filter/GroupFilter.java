package com.keywatch.filter;

import com.keywatch.shared.model.GroupRule;

/**
 * Decides whether a source chat is eligible for matching. Blacklist entries always win.
 */
public class GroupFilter {

    public boolean allow(GroupRule rules, long chatId, String chatName) {
        for (var entry : rules.blacklist()) {
            if (GroupRule.matches(entry, chatId, chatName)) return false;
        }
        if (rules.whitelist().isEmpty()) return true;
        for (var entry : rules.whitelist()) {
            if (GroupRule.matches(entry, chatId, chatName)) return true;
        }
        return false;
    }
}
