package com.mailrag.retrieval;

import java.util.ArrayList;
import java.util.List;

import com.mailrag.inference.ChatMessage;

public class Conversation {
    private String systemContext;
    private final List<ChatMessage> turns = new ArrayList<>();

    public boolean isNew() {
        return systemContext == null;
    }

    public String systemContext() {
        return systemContext;
    }

    void start(String systemContext) {
        this.systemContext = systemContext;
    }

    public List<ChatMessage> turns() {
        return List.copyOf(turns);
    }

    void append(ChatMessage question, ChatMessage reply) {
        turns.add(question);
        turns.add(reply);
    }

    public void reset() {
        systemContext = null;
        turns.clear();
    }
}
