package com.linlay.agentsview.store;

import com.linlay.agentsview.model.ParsedMessage;

import java.util.List;
import java.util.Optional;

/**
 * Write path and the two read paths the sync engine depends on. Implementations serialize
 * all writes; they throw {@link IllegalStateException} when the underlying store fails.
 */
public interface SessionStore {

    Optional<SessionFileInfo> getSessionFileInfo(String sessionId);

    Optional<SessionRecord> getSessionFull(String sessionId);

    void upsertSession(SessionRecord session);

    /**
     * Deletes every stored message of the session, then inserts {@code messages}.
     */
    void replaceSessionMessages(String sessionId, List<ParsedMessage> messages);

    /**
     * {@link #upsertSession} followed by {@link #replaceSessionMessages} in one transaction.
     */
    void syncSession(SessionRecord session, List<ParsedMessage> messages);

    List<ParsedMessage> getAllMessages(String sessionId);

    boolean deleteSession(String sessionId);
}
