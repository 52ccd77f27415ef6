/* (C)2026 */
package com.ammann.updatetracker.cache;

import com.ammann.updatetracker.model.ContainerPayload;
import com.ammann.updatetracker.model.TrackedItem;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Field-level merge of container payloads.
 *
 * <p>Items of the same instance are matched by container id, then by 12-character short id,
 * then by name (a container recreated by an upgrade keeps its name but gets a new id). A
 * matched item takes identity, topology and current-image fields from the incoming item; its
 * registry fields are only overwritten when the incoming item carries registry data.
 */
final class PayloadMerger {

    private static final int SHORT_ID_LENGTH = 12;

    private PayloadMerger() {}

    /**
     * Merges a partial payload into a prior one.
     *
     * @param prior                  the cached payload
     * @param partial                the freshly fetched items
     * @param authoritativeInstances instances that were listed completely; prior items of these
     *                               instances without a counterpart are dropped
     * @return the merged payload
     */
    static ContainerPayload merge(
            ContainerPayload prior, ContainerPayload partial, Set<String> authoritativeInstances) {
        List<TrackedItem> priorItems = prior.items();
        boolean[] matched = new boolean[priorItems.size()];
        TrackedItem[] replacements = new TrackedItem[priorItems.size()];
        List<TrackedItem> added = new ArrayList<>();

        for (TrackedItem incoming : partial.items()) {
            int index = findMatch(priorItems, matched, incoming);
            if (index < 0) {
                added.add(incoming);
            } else {
                matched[index] = true;
                replacements[index] = mergeItem(priorItems.get(index), incoming);
            }
        }

        List<TrackedItem> items = new ArrayList<>(priorItems.size() + added.size());
        for (int i = 0; i < priorItems.size(); i++) {
            if (matched[i]) {
                items.add(replacements[i]);
            } else if (!authoritativeInstances.contains(priorItems.get(i).instance())) {
                items.add(priorItems.get(i));
            }
        }
        items.addAll(added);

        Map<String, Integer> unused = new HashMap<>(prior.unusedImagesByInstance());
        unused.putAll(partial.unusedImagesByInstance());
        return new ContainerPayload(items, unused);
    }

    /**
     * Builds the payload of a full refresh. Items whose registry check produced no result keep
     * the registry data of their prior counterpart; prior items without a counterpart are
     * dropped.
     *
     * @param prior the cached payload
     * @param full  the complete, freshly fetched payload
     * @return the payload to store
     */
    static ContainerPayload carryForward(ContainerPayload prior, ContainerPayload full) {
        List<TrackedItem> priorItems = prior.items();
        boolean[] matched = new boolean[priorItems.size()];
        List<TrackedItem> items = new ArrayList<>(full.items().size());

        for (TrackedItem incoming : full.items()) {
            int index = findMatch(priorItems, matched, incoming);
            if (index >= 0) {
                matched[index] = true;
                items.add(mergeItem(priorItems.get(index), incoming));
            } else {
                items.add(incoming);
            }
        }
        return new ContainerPayload(items, full.unusedImagesByInstance());
    }

    static TrackedItem mergeItem(TrackedItem prior, TrackedItem incoming) {
        if (incoming.hasRegistryData() || !prior.hasRegistryData()) {
            return incoming;
        }
        return incoming.withRegistryDataFrom(prior);
    }

    private static int findMatch(
            List<TrackedItem> priorItems, boolean[] matched, TrackedItem item) {
        for (int i = 0; i < priorItems.size(); i++) {
            TrackedItem candidate = priorItems.get(i);
            if (!matched[i]
                    && Objects.equals(candidate.instance(), item.instance())
                    && Objects.equals(candidate.id(), item.id())) {
                return i;
            }
        }
        for (int i = 0; i < priorItems.size(); i++) {
            TrackedItem candidate = priorItems.get(i);
            if (!matched[i]
                    && Objects.equals(candidate.instance(), item.instance())
                    && sameShortId(candidate.id(), item.id())) {
                return i;
            }
        }
        for (int i = 0; i < priorItems.size(); i++) {
            TrackedItem candidate = priorItems.get(i);
            if (!matched[i]
                    && item.name() != null
                    && Objects.equals(candidate.instance(), item.instance())
                    && item.name().equals(candidate.name())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean sameShortId(String a, String b) {
        if (a == null
                || b == null
                || a.length() < SHORT_ID_LENGTH
                || b.length() < SHORT_ID_LENGTH) {
            return false;
        }
        return a.substring(0, SHORT_ID_LENGTH).equals(b.substring(0, SHORT_ID_LENGTH));
    }
}
