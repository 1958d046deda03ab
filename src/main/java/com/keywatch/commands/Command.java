package com.keywatch.commands;

import com.keywatch.shared.model.GroupRule.ListKind;

/**
 * A decoded control command. Each recognized command word maps to exactly one record type;
 * {@link CommandProcessor} dispatches on the type.
 */
public interface Command {

    enum ListAction { LIST, ADD, REMOVE, CLEAR }

    record Help() implements Command {}

    record ListKeywords() implements Command {}

    record AddKeyword(String pattern) implements Command {}

    record RemoveKeyword(String selector) implements Command {}

    record ClearKeywords() implements Command {}

    record GroupsHelp() implements Command {}

    record GroupList(ListKind kind, ListAction action, String argument) implements Command {}

    record ShowDuplicates() implements Command {}

    record SetDuplicates(boolean enabled) implements Command {}

    record SetExpiry(int hours) implements Command {}

    record SetIncludeSender(boolean include) implements Command {}

    record DuplicatesStatus() implements Command {}

    record ShowTarget() implements Command {}

    record SetTarget(String value) implements Command {}

    record TestTarget() implements Command {}

    record CheckTarget(String value) implements Command {}

    record Status() implements Command {}

    /** A recognized command word with unusable arguments; carries the reply to send. */
    record Usage(String message) implements Command {}
}
