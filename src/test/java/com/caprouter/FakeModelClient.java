package com.caprouter;

import com.caprouter.llm.ModelClient;
import com.caprouter.models.ChatMessage;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Scripted model: returns the queued replies in order, then keeps repeating the last one.
 * Records every call.
 */
public class FakeModelClient implements ModelClient {
    private final Deque<String> replies;
    private String lastReply = "";
    private final List<List<ChatMessage>> calls = new ArrayList<>();
    private final List<String> systemPrompts = new ArrayList<>();

    public FakeModelClient(String... replies) {
        this.replies = new ArrayDeque<>(Arrays.asList(replies));
    }

    @Override
    public String generate(List<ChatMessage> messages, String systemPrompt) {
        calls.add(new ArrayList<>(messages));
        systemPrompts.add(systemPrompt);
        if (!replies.isEmpty()) {
            lastReply = replies.poll();
        }
        return lastReply;
    }

    public int getCallCount() {
        return calls.size();
    }

    public List<ChatMessage> getCall(int index) {
        return calls.get(index);
    }

    public String getSystemPrompt(int index) {
        return systemPrompts.get(index);
    }
}
