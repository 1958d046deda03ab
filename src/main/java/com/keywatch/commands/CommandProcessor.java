package com.keywatch.commands;

import com.keywatch.commands.Command.ListAction;
import com.keywatch.dedup.DedupCache;
import com.keywatch.filter.KeywordMatcher;
import com.keywatch.filter.PatternException;
import com.keywatch.notify.DispatchException;
import com.keywatch.notify.NotificationDispatcher;
import com.keywatch.observability.MonitorStats;
import com.keywatch.shared.config.ConfigStore;
import com.keywatch.shared.config.ConfigTransaction.Outcome;
import com.keywatch.shared.model.GroupRule;
import com.keywatch.shared.model.Keyword;
import com.keywatch.shared.model.NotificationTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Executes control commands against the live config. Every mutating command is a single
 * {@link ConfigStore#mutate} transaction and its reply reflects the committed state.
 */
public class CommandProcessor {

    private static final Logger log = LoggerFactory.getLogger(CommandProcessor.class);

    static final String HELP = """
            KeyWatch commands

            Keywords:
            /keywords - list all keywords
            /add <keyword> - add a keyword or regex
            /remove <number|keyword> - remove a keyword
            /clear - remove all keywords

            Groups:
            /groups - group filter help
            /whitelist <add|remove|list|clear> - manage the whitelist
            /blacklist <add|remove|list|clear> - manage the blacklist

            Duplicate detection:
            /duplicates - show settings
            /duplicates on|off - enable or disable
            /duplicates hours <n> - set the expiry window
            /duplicates sender on|off - include the sender in the hash
            /duplicates debug status - cache statistics

            Notification target:
            /target - show the current target
            /target set <me|@channel|chat id|invite link> - change the target
            /target test - send a test notification
            /target check <value> - check permissions without saving

            /status - monitor status
            /help - this help

            Examples:
            /add python
            /add (?i)machine learning
            /remove 1
            /whitelist add Python Jobs""";

    static final String GROUPS_HELP = """
            Group filters

            Whitelist (only these chats are monitored):
            /whitelist add <name or chat id>
            /whitelist remove <number or name>
            /whitelist list
            /whitelist clear

            Blacklist (these chats are never monitored):
            /blacklist add <name or chat id>
            /blacklist remove <number or name>
            /blacklist list
            /blacklist clear

            A chat on the blacklist is skipped even if it is also whitelisted.
            When the whitelist is empty every other chat is monitored.""";

    private final ConfigStore configStore;
    private final DedupCache dedupCache;
    private final NotificationDispatcher dispatcher;
    private final MonitorStats stats;
    private final Map<Class<? extends Command>, Function<Command, String>> handlers = new HashMap<>();

    public CommandProcessor(ConfigStore configStore, DedupCache dedupCache,
                            NotificationDispatcher dispatcher, MonitorStats stats) {
        this.configStore = configStore;
        this.dedupCache = dedupCache;
        this.dispatcher = dispatcher;
        this.stats = stats;

        on(Command.Help.class, c -> HELP);
        on(Command.ListKeywords.class, c -> listKeywords());
        on(Command.AddKeyword.class, this::addKeyword);
        on(Command.RemoveKeyword.class, this::removeKeyword);
        on(Command.ClearKeywords.class, c -> clearKeywords());
        on(Command.GroupsHelp.class, c -> GROUPS_HELP);
        on(Command.GroupList.class, this::groupList);
        on(Command.ShowDuplicates.class, c -> showDuplicates());
        on(Command.SetDuplicates.class, this::setDuplicates);
        on(Command.SetExpiry.class, this::setExpiry);
        on(Command.SetIncludeSender.class, this::setIncludeSender);
        on(Command.DuplicatesStatus.class, c -> duplicatesStatus());
        on(Command.ShowTarget.class, c -> showTarget());
        on(Command.SetTarget.class, this::setTarget);
        on(Command.TestTarget.class, c -> testTarget());
        on(Command.CheckTarget.class, this::checkTarget);
        on(Command.Status.class, c -> status());
        on(Command.Usage.class, Command.Usage::message);
    }

    private <T extends Command> void on(Class<T> type, Function<T, String> handler) {
        handlers.put(type, command -> handler.apply(type.cast(command)));
    }

    public String execute(Command command) {
        var handler = handlers.get(command.getClass());
        if (handler == null) {
            throw new IllegalArgumentException("No handler for command " + command.getClass().getSimpleName());
        }
        log.info("Processing command: {}", command);
        return handler.apply(command);
    }

    private String listKeywords() {
        var keywords = configStore.snapshot().keywords();
        if (keywords.isEmpty()) {
            return "No keywords configured.\n\nUse /add <keyword> to add one.";
        }
        var sb = new StringBuilder("Current keywords (" + keywords.size() + "):\n\n");
        for (int i = 0; i < keywords.size(); i++) {
            var keyword = keywords.get(i);
            sb.append(i + 1).append(". ").append(keyword.pattern());
            if (keyword.isRegex()) sb.append(" (regex)");
            sb.append('\n');
        }
        sb.append("\nUse /remove <number> to delete one.");
        return sb.toString();
    }

    private String addKeyword(Command.AddKeyword command) {
        var pattern = command.pattern().strip();
        if (pattern.isEmpty()) {
            return "Please provide a keyword.\n\nExample: /add python";
        }
        var keyword = new Keyword(pattern);
        try {
            KeywordMatcher.validate(keyword);
        } catch (PatternException e) {
            return "Invalid regular expression: " + e.getMessage() + "\n\nExample: /add (?i)machine learning";
        }
        return configStore.mutate(current -> {
            var existing = current.keywords().stream().filter(keyword::sameAs).findFirst();
            if (existing.isPresent()) {
                return Outcome.unchanged("Keyword '" + existing.get().pattern() + "' already exists.");
            }
            var next = new ArrayList<>(current.keywords());
            next.add(keyword);
            return Outcome.commit(current.withKeywords(next),
                    "Keyword '" + pattern + "' added.\n\nTotal keywords: " + next.size());
        });
    }

    private String removeKeyword(Command.RemoveKeyword command) {
        var selector = command.selector().strip();
        return configStore.mutate(current -> {
            var keywords = current.keywords();
            if (keywords.isEmpty()) {
                return Outcome.unchanged("No keywords to remove.");
            }
            if (selector.isEmpty()) {
                return Outcome.unchanged("Please provide a number or the keyword.\n\nExample: /remove 1 or /remove python");
            }
            int index = positionOf(selector, keywords.size());
            if (index < 0) {
                for (int i = 0; i < keywords.size(); i++) {
                    if (keywords.get(i).sameAs(selector)) {
                        index = i;
                        break;
                    }
                }
            }
            if (index < 0) {
                return Outcome.unchanged("Keyword '" + selector + "' not found. Use a number between 1 and "
                        + keywords.size() + " or the keyword text.");
            }
            var next = new ArrayList<>(keywords);
            var removed = next.remove(index);
            return Outcome.commit(current.withKeywords(next),
                    "Keyword '" + removed.pattern() + "' removed.\n\nRemaining keywords: " + next.size());
        });
    }

    private String clearKeywords() {
        return configStore.mutate(current -> {
            int count = current.keywords().size();
            if (count == 0) {
                return Outcome.unchanged("No keywords to clear.");
            }
            return Outcome.commit(current.withKeywords(List.of()), "Cleared all " + count + " keywords.");
        });
    }

    private String groupList(Command.GroupList command) {
        var kind = command.kind();
        var label = kind.label();
        if (command.action() == ListAction.LIST) {
            var entries = configStore.snapshot().groups().list(kind);
            if (entries.isEmpty()) {
                return capitalize(label) + " is empty.";
            }
            var sb = new StringBuilder(capitalize(label) + " (" + entries.size() + "):\n\n");
            for (int i = 0; i < entries.size(); i++) {
                sb.append(i + 1).append(". ").append(entries.get(i)).append('\n');
            }
            return sb.toString().stripTrailing();
        }
        return configStore.mutate(current -> {
            var groups = current.groups();
            var entries = groups.list(kind);
            var argument = command.argument();
            switch (command.action()) {
                case ADD: {
                    if (GroupRule.indexOf(entries, argument) >= 0) {
                        return Outcome.unchanged("Group '" + argument + "' is already on the " + label + ".");
                    }
                    var next = groups.withEntry(kind, argument);
                    return Outcome.commit(current.withGroups(next), "Group '" + argument + "' added to the "
                            + label + ".\n\nEntries: " + next.list(kind).size());
                }
                case REMOVE: {
                    int index = positionOf(argument, entries.size());
                    if (index < 0) index = GroupRule.indexOf(entries, argument);
                    if (index < 0) {
                        return Outcome.unchanged("Group '" + argument + "' not found on the " + label + ".");
                    }
                    var remaining = new ArrayList<>(entries);
                    var removed = remaining.remove(index);
                    return Outcome.commit(current.withGroups(groups.withList(kind, remaining)),
                            "Group '" + removed + "' removed from the " + label + ".");
                }
                case CLEAR: {
                    if (entries.isEmpty()) {
                        return Outcome.unchanged(capitalize(label) + " is already empty.");
                    }
                    return Outcome.commit(current.withGroups(groups.withList(kind, List.of())),
                            capitalize(label) + " cleared (" + entries.size() + " entries removed).");
                }
                default:
                    return Outcome.unchanged("Unsupported action: " + command.action());
            }
        });
    }

    private String showDuplicates() {
        var dup = configStore.snapshot().duplicates();
        return "Duplicate detection settings:\n\n"
                + "Status: " + (dup.enabled() ? "enabled" : "disabled") + "\n"
                + "Expiry: " + dup.expiryHours() + " hours\n"
                + "Include sender: " + yesNo(dup.includeSender()) + "\n\n"
                + "Commands:\n"
                + "/duplicates on|off\n"
                + "/duplicates hours <n>\n"
                + "/duplicates sender on|off\n"
                + "/duplicates debug status";
    }

    private String setDuplicates(Command.SetDuplicates command) {
        return configStore.mutate(current -> Outcome.commit(
                current.withDuplicates(current.duplicates().withEnabled(command.enabled())),
                command.enabled() ? "Duplicate detection enabled." : "Duplicate detection disabled."));
    }

    private String setExpiry(Command.SetExpiry command) {
        return configStore.mutate(current -> Outcome.commit(
                current.withDuplicates(current.duplicates().withExpiryHours(command.hours())),
                "Duplicate expiry set to " + command.hours() + " hours."));
    }

    private String setIncludeSender(Command.SetIncludeSender command) {
        return configStore.mutate(current -> Outcome.commit(
                current.withDuplicates(current.duplicates().withIncludeSender(command.include())),
                command.include()
                        ? "Sender is now part of duplicate detection."
                        : "Sender is now ignored by duplicate detection."));
    }

    private String duplicatesStatus() {
        var stats = dedupCache.stats(configStore.snapshot().duplicates());
        return "Dedup cache status:\n\n"
                + "Enabled: " + yesNo(stats.enabled()) + "\n"
                + "Entries: " + stats.entries() + "\n"
                + "Live entries: " + stats.liveEntries() + "\n"
                + "Expiry: " + stats.expiryHours() + " hours";
    }

    private String showTarget() {
        var target = configStore.snapshot().target();
        return "Notification target: " + target.describe() + "\n\n"
                + "Use /target set <value> to change it, /target test to verify it.";
    }

    private String setTarget(Command.SetTarget command) {
        NotificationTarget target;
        try {
            target = NotificationTarget.parse(command.value());
        } catch (IllegalArgumentException e) {
            return e.getMessage() + "\n\nUse me, @channel, a numeric chat id or an invite link.";
        }
        return configStore.mutate(current -> {
            if (current.target().equals(target)) {
                return Outcome.unchanged("Notification target is already " + target.describe() + ".");
            }
            return Outcome.commit(current.withTarget(target),
                    "Notification target set to " + target.describe() + ".\n\nUse /target test to verify it.");
        });
    }

    private String testTarget() {
        try {
            var ref = dispatcher.sendTest();
            return "Test notification sent to " + ref.title() + ".";
        } catch (DispatchException e) {
            log.warn("Target test failed: {}", e.getMessage());
            return "Test notification failed: " + e.getMessage();
        }
    }

    private String checkTarget(Command.CheckTarget command) {
        NotificationTarget target;
        try {
            target = NotificationTarget.parse(command.value());
        } catch (IllegalArgumentException e) {
            return e.getMessage() + "\n\nUse me, @channel, a numeric chat id or an invite link.";
        }
        try {
            var ref = dispatcher.probe(target);
            return "Target " + target.describe() + " is usable (" + ref.title() + "). Nothing was saved.";
        } catch (DispatchException e) {
            log.warn("Target check failed: {}", e.getMessage());
            return "Target check failed: " + e.getMessage();
        }
    }

    private String status() {
        var config = configStore.snapshot();
        var dup = config.duplicates();
        var counters = stats.snapshot();
        return "Monitor status:\n\n"
                + "Uptime: " + MonitorStats.formatUptime(stats.uptime()) + "\n"
                + "Keywords: " + config.keywords().size() + "\n"
                + "Case sensitive: " + yesNo(config.settings().caseSensitive()) + "\n"
                + "Full messages: " + yesNo(config.settings().sendFullMessage()) + "\n"
                + "Max message length: " + config.settings().maxMessageLength() + "\n\n"
                + "Whitelist: " + config.groups().whitelist().size() + " groups\n"
                + "Blacklist: " + config.groups().blacklist().size() + " groups\n\n"
                + "Duplicate detection: " + (dup.enabled() ? "enabled" : "disabled") + "\n"
                + "Expiry: " + dup.expiryHours() + " hours\n"
                + "Include sender: " + yesNo(dup.includeSender()) + "\n"
                + "Dedup cache: " + dedupCache.size() + " entries\n\n"
                + "Target: " + config.target().describe() + "\n\n"
                + "Received: " + counters.received()
                + ", matched: " + counters.matched()
                + ", duplicates: " + counters.duplicates()
                + ", sent: " + counters.sent()
                + ", failed: " + counters.failed();
    }

    /** 1-based position to 0-based index, or -1 when the argument is not an in-range number. */
    private static int positionOf(String argument, int size) {
        if (!argument.matches("\\d{1,9}")) return -1;
        int position = Integer.parseInt(argument);
        return position >= 1 && position <= size ? position - 1 : -1;
    }

    private static String yesNo(boolean value) {
        return value ? "yes" : "no";
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
