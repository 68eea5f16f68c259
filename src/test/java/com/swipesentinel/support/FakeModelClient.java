package com.swipesentinel.support;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swipesentinel.api.ModelClient;
import com.swipesentinel.api.ModelErrorKind;
import com.swipesentinel.api.ModelReply;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Returns queued replies in order; the last one repeats once the queue drains. */
public class FakeModelClient implements ModelClient {

    private final Deque<ModelReply> replies  = new ArrayDeque<>();
    private final List<ObjectNode>  requests = new ArrayList<>();
    private ModelReply last;

    public static FakeModelClient replying(String... contents) {
        FakeModelClient client = new FakeModelClient();
        for (String c : contents) client.enqueue(ModelReply.success(c, "gpt-4.1-mini", 900, 60, 5, 1));
        return client;
    }

    public static FakeModelClient failing(ModelErrorKind kind, String message) {
        FakeModelClient client = new FakeModelClient();
        client.enqueue(ModelReply.error(kind, message, "gpt-4.1-mini", 5, 2));
        return client;
    }

    public FakeModelClient enqueue(ModelReply reply) {
        replies.add(reply);
        return this;
    }

    @Override
    public synchronized ModelReply complete(ObjectNode requestBody) {
        requests.add(requestBody.deepCopy());
        if (!replies.isEmpty()) last = replies.poll();
        if (last == null) throw new IllegalStateException("FakeModelClient: no reply queued");
        return last;
    }

    public synchronized List<ObjectNode> getRequests() { return List.copyOf(requests); }
    public synchronized int              getCalls()    { return requests.size(); }
}
