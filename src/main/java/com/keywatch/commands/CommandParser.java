package com.keywatch.commands;

import com.keywatch.commands.Command.ListAction;
import com.keywatch.shared.config.MonitorConfig.DedupSettings;
import com.keywatch.shared.model.GroupRule.ListKind;

import java.util.Locale;
import java.util.Optional;

/**
 * Decodes control-channel text into a {@link Command}. Text that is not a recognized command word
 * yields empty and is ignored by the caller.
 */
public class CommandParser {

    public Optional<Command> parse(String text) {
        if (text == null) return Optional.empty();
        var trimmed = text.strip();
        if (!trimmed.startsWith("/")) return Optional.empty();

        var parts = trimmed.split("\\s+", 2);
        var word = parts[0].substring(1).toLowerCase(Locale.ROOT);
        // Telegram clients append @BotName to commands picked from the menu
        int at = word.indexOf('@');
        if (at >= 0) word = word.substring(0, at);
        var rest = parts.length > 1 ? parts[1].strip() : "";

        switch (word) {
            case "help":
                return Optional.of(new Command.Help());
            case "keywords":
                return Optional.of(new Command.ListKeywords());
            case "add":
                return Optional.of(new Command.AddKeyword(rest));
            case "remove":
                return Optional.of(new Command.RemoveKeyword(rest));
            case "clear":
                return Optional.of(new Command.ClearKeywords());
            case "groups":
                return Optional.of(new Command.GroupsHelp());
            case "whitelist":
                return Optional.of(groupList(ListKind.WHITELIST, rest));
            case "blacklist":
                return Optional.of(groupList(ListKind.BLACKLIST, rest));
            case "duplicates":
                return Optional.of(duplicates(rest));
            case "target":
                return Optional.of(target(rest));
            case "status":
                return Optional.of(new Command.Status());
            default:
                return Optional.empty();
        }
    }

    private Command groupList(ListKind kind, String rest) {
        var name = kind.label();
        if (rest.isEmpty()) {
            return new Command.Usage("Please specify an action: add, remove, list, clear\n\nExample: /" + name + " list");
        }
        var parts = rest.split("\\s+", 2);
        var argument = parts.length > 1 ? parts[1].strip() : "";
        switch (parts[0].toLowerCase(Locale.ROOT)) {
            case "list":
                return new Command.GroupList(kind, ListAction.LIST, "");
            case "clear":
                return new Command.GroupList(kind, ListAction.CLEAR, "");
            case "add":
                if (argument.isEmpty()) {
                    return new Command.Usage("Please provide a group name or chat id.\n\nExample: /" + name + " add Python Developers");
                }
                return new Command.GroupList(kind, ListAction.ADD, argument);
            case "remove":
                if (argument.isEmpty()) {
                    return new Command.Usage("Please provide a number or group name.\n\nExample: /" + name + " remove 1");
                }
                return new Command.GroupList(kind, ListAction.REMOVE, argument);
            default:
                return new Command.Usage("Unknown action: " + parts[0] + "\n\nAvailable actions: add, remove, list, clear");
        }
    }

    private Command duplicates(String rest) {
        if (rest.isEmpty()) return new Command.ShowDuplicates();
        var args = rest.toLowerCase(Locale.ROOT).split("\\s+");
        switch (args[0]) {
            case "on":
                return new Command.SetDuplicates(true);
            case "off":
                return new Command.SetDuplicates(false);
            case "hours":
                return expiry(args);
            case "sender":
                if (args.length < 2 || !(args[1].equals("on") || args[1].equals("off"))) {
                    return new Command.Usage("Use 'on' or 'off'.\n\nExample: /duplicates sender off");
                }
                return new Command.SetIncludeSender(args[1].equals("on"));
            case "debug":
            case "status":
                if (args[0].equals("debug") && args.length > 1 && !args[1].equals("status")) {
                    return new Command.Usage("Unknown debug action: " + args[1] + "\n\nExample: /duplicates debug status");
                }
                return new Command.DuplicatesStatus();
            default:
                return new Command.Usage("Unknown action: " + args[0] + "\n\nAvailable actions: on, off, hours, sender, debug status");
        }
    }

    private Command expiry(String[] args) {
        if (args.length < 2) {
            return new Command.Usage("Please provide the number of hours.\n\nExample: /duplicates hours 12");
        }
        int hours;
        try {
            hours = Integer.parseInt(args[1]);
        } catch (NumberFormatException e) {
            return new Command.Usage("Invalid number. Example: /duplicates hours 12");
        }
        if (hours < DedupSettings.MIN_EXPIRY_HOURS || hours > DedupSettings.MAX_EXPIRY_HOURS) {
            return new Command.Usage("Hours must be between " + DedupSettings.MIN_EXPIRY_HOURS
                    + " and " + DedupSettings.MAX_EXPIRY_HOURS + " (one week).");
        }
        return new Command.SetExpiry(hours);
    }

    private Command target(String rest) {
        if (rest.isEmpty()) return new Command.ShowTarget();
        var parts = rest.split("\\s+", 2);
        var argument = parts.length > 1 ? parts[1].strip() : "";
        switch (parts[0].toLowerCase(Locale.ROOT)) {
            case "set":
                if (argument.isEmpty()) {
                    return new Command.Usage("Please provide a target: me, @channel, a chat id or an invite link.\n\nExample: /target set @my_alerts");
                }
                return new Command.SetTarget(argument);
            case "test":
                return new Command.TestTarget();
            case "check":
                if (argument.isEmpty()) {
                    return new Command.Usage("Please provide a target to check.\n\nExample: /target check -1001234567890");
                }
                return new Command.CheckTarget(argument);
            default:
                return new Command.Usage("Unknown action: " + parts[0] + "\n\nAvailable actions: set, test, check");
        }
    }
}
