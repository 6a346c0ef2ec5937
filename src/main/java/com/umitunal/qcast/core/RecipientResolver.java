package com.umitunal.qcast.core;

import java.util.List;
import java.util.Set;

/**
 * Resolves group identifiers to the recipients currently in them.
 */
@FunctionalInterface
public interface RecipientResolver {

    /**
     * List the distinct recipients that belong to any of the given groups.
     *
     * @param groupIds group identifiers, never null
     * @return recipient ids; empty when the groups have no members
     */
    List<String> listRecipients(Set<String> groupIds) throws Exception;
}
