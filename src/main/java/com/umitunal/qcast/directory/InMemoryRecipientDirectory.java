package com.umitunal.qcast.directory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.umitunal.qcast.core.RecipientResolver;
import com.umitunal.qcast.serialization.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Group membership held in memory.
 *
 * A recipient belongs to at most one group; assigning a recipient to another
 * group moves them. Lookups return members in registration order.
 */
public class InMemoryRecipientDirectory implements RecipientResolver {
    private static final Logger log = LoggerFactory.getLogger(InMemoryRecipientDirectory.class);
    private static final TypeReference<LinkedHashMap<String, List<String>>> SEED_TYPE = new TypeReference<>() {
    };

    private final Map<String, Set<String>> membersByGroup = new LinkedHashMap<>();
    private final Map<String, String> groupByRecipient = new HashMap<>();

    /**
     * Register an empty group. Existing groups are left untouched.
     */
    public synchronized void addGroup(String groupId) {
        membersByGroup.computeIfAbsent(groupId, id -> new LinkedHashSet<>());
    }

    /**
     * Put a recipient in a group, removing them from any previous group.
     */
    public synchronized void assign(String recipientId, String groupId) {
        String previous = groupByRecipient.put(recipientId, groupId);
        if (groupId.equals(previous)) {
            return;
        }
        if (previous != null) {
            membersByGroup.get(previous).remove(recipientId);
        }
        membersByGroup.computeIfAbsent(groupId, id -> new LinkedHashSet<>()).add(recipientId);
    }

    /**
     * @return false if the recipient was not registered
     */
    public synchronized boolean remove(String recipientId) {
        String group = groupByRecipient.remove(recipientId);
        if (group == null) {
            return false;
        }
        membersByGroup.get(group).remove(recipientId);
        return true;
    }

    public synchronized String groupOf(String recipientId) {
        return groupByRecipient.get(recipientId);
    }

    public synchronized List<String> members(String groupId) {
        Set<String> members = membersByGroup.get(groupId);
        return members == null ? Collections.emptyList() : new ArrayList<>(members);
    }

    public synchronized Set<String> groups() {
        return new LinkedHashSet<>(membersByGroup.keySet());
    }

    /**
     * Member count of every registered group.
     */
    public synchronized Map<String, Integer> countByGroup() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        membersByGroup.forEach((group, members) -> counts.put(group, members.size()));
        return counts;
    }

    public synchronized int size() {
        return groupByRecipient.size();
    }

    @Override
    public synchronized List<String> listRecipients(Set<String> groupIds) {
        Set<String> recipients = new LinkedHashSet<>();
        for (String groupId : groupIds) {
            Set<String> members = membersByGroup.get(groupId);
            if (members != null) {
                recipients.addAll(members);
            }
        }
        return new ArrayList<>(recipients);
    }

    /**
     * Load memberships from a JSON object mapping each group to its recipient ids.
     */
    public void load(InputStream json) throws IOException {
        ObjectMapper mapper = JsonCodec.createDefaultMapper();
        Map<String, List<String>> seed = mapper.readValue(json, SEED_TYPE);
        int loaded = 0;
        for (Map.Entry<String, List<String>> entry : seed.entrySet()) {
            addGroup(entry.getKey());
            List<String> members = entry.getValue() == null ? Collections.emptyList() : entry.getValue();
            for (String recipientId : members) {
                assign(recipientId, entry.getKey());
                loaded++;
            }
        }
        log.info("Loaded {} recipients in {} groups", loaded, seed.size());
    }

    public static InMemoryRecipientDirectory fromJsonFile(Path path) throws IOException {
        InMemoryRecipientDirectory directory = new InMemoryRecipientDirectory();
        try (InputStream in = Files.newInputStream(path)) {
            directory.load(in);
        }
        return directory;
    }
}
