package com.linlay.agentsview.model;

import java.util.List;

public record ParseResult(ParsedSession session, List<ParsedMessage> messages) {

    public ParseResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
