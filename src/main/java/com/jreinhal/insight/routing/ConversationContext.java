package com.jreinhal.insight.routing;

import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Everything the router may show the interpreter besides the utterance: the most recent
 * messages of this conversation and the caller's visible categories.
 */
public record ConversationContext(String conversationId, List<Message> recentMessages, Set<String> visibleCategories) {

    public ConversationContext {
        recentMessages = recentMessages == null ? List.of() : List.copyOf(recentMessages);
        visibleCategories = visibleCategories == null ? Set.of() : Set.copyOf(new TreeSet<String>(visibleCategories));
    }

    public static ConversationContext empty(String conversationId, Collection<String> visibleCategories) {
        return new ConversationContext(conversationId, List.of(), visibleCategories == null ? Set.of() : Set.copyOf(visibleCategories));
    }

    public ConversationContext withVisibleCategories(Collection<String> categories) {
        return new ConversationContext(this.conversationId, this.recentMessages, categories == null ? Set.of() : Set.copyOf(categories));
    }

    public record Message(String role, String content) {
    }
}
