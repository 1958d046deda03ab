package com.keywatch.commands;

import com.keywatch.commands.Command.ListAction;
import com.keywatch.shared.model.GroupRule.ListKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CommandParserTest {

    private final CommandParser parser = new CommandParser();

    private Command parse(String text) {
        return parser.parse(text).orElseThrow();
    }

    @Test
    void plainTextAndUnknownCommandsAreIgnored() {
        assertTrue(parser.parse("hello there").isEmpty());
        assertTrue(parser.parse("/start").isEmpty());
        assertTrue(parser.parse(null).isEmpty());
    }

    @Test
    void commandWordIsCaseInsensitiveAndBotSuffixIsDropped() {
        assertEquals(new Command.Help(), parse("/HELP"));
        assertEquals(new Command.Status(), parse("/status@KeyWatchBot"));
    }

    @Test
    void addKeepsTheWholeRest() {
        assertEquals(new Command.AddKeyword("(?i)machine learning"), parse("/add   (?i)machine learning "));
        assertEquals(new Command.AddKeyword(""), parse("/add"));
        assertEquals(new Command.RemoveKeyword("2"), parse("/remove 2"));
    }

    @Test
    void groupListActions() {
        assertEquals(new Command.GroupList(ListKind.WHITELIST, ListAction.ADD, "Python Jobs"),
                parse("/whitelist add Python Jobs"));
        assertEquals(new Command.GroupList(ListKind.BLACKLIST, ListAction.LIST, ""), parse("/blacklist LIST"));
        assertEquals(new Command.GroupList(ListKind.BLACKLIST, ListAction.CLEAR, ""), parse("/blacklist clear"));
        assertInstanceOf(Command.Usage.class, parse("/whitelist"));
        assertInstanceOf(Command.Usage.class, parse("/whitelist add"));
        assertInstanceOf(Command.Usage.class, parse("/blacklist nuke"));
    }

    @Test
    void duplicatesSubcommands() {
        assertEquals(new Command.ShowDuplicates(), parse("/duplicates"));
        assertEquals(new Command.SetDuplicates(false), parse("/duplicates off"));
        assertEquals(new Command.SetExpiry(12), parse("/duplicates hours 12"));
        assertEquals(new Command.SetIncludeSender(false), parse("/duplicates sender off"));
        assertEquals(new Command.DuplicatesStatus(), parse("/duplicates debug status"));
    }

    @Test
    void expiryOutsideOneWeekIsRejected() {
        var usage = (Command.Usage) parse("/duplicates hours 169");
        assertEquals("Hours must be between 1 and 168 (one week).", usage.message());
        assertInstanceOf(Command.Usage.class, parse("/duplicates hours 0"));
        assertInstanceOf(Command.Usage.class, parse("/duplicates hours soon"));
        assertEquals(new Command.SetExpiry(168), parse("/duplicates hours 168"));
    }

    @Test
    void targetSubcommands() {
        assertEquals(new Command.ShowTarget(), parse("/target"));
        assertEquals(new Command.SetTarget("@alerts"), parse("/target set @alerts"));
        assertEquals(new Command.TestTarget(), parse("/target test"));
        assertEquals(new Command.CheckTarget("-100123"), parse("/target check -100123"));
        assertInstanceOf(Command.Usage.class, parse("/target set"));
    }
}
