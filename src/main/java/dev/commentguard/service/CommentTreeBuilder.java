package dev.commentguard.service;

import dev.commentguard.dto.CommentResponse;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds reply trees out of flat comment lists.
 * <p>
 * Children keep the relative order of the input. A comment whose parent is
 * not in the input (deleted, hidden or on another page) is shown as a root
 * rather than dropped. The viewer-flag walks touch only their own flag and
 * can run in either order.
 * </p>
 */
public final class CommentTreeBuilder {

    private CommentTreeBuilder() {
        // utility class
    }

    public static List<CommentResponse> buildTree(List<CommentResponse> flat) {
        Map<String, CommentResponse> byId = new LinkedHashMap<>();
        for (CommentResponse comment : flat) {
            comment.setReplies(new ArrayList<>());
            byId.put(comment.getId(), comment);
        }

        List<CommentResponse> roots = new ArrayList<>();
        Set<String> cut = new HashSet<>();
        for (CommentResponse comment : flat) {
            String parentId = comment.getParentId();
            CommentResponse parent = parentId != null ? byId.get(parentId) : null;
            if (parent != null && !closesLoop(comment, byId, cut)) {
                parent.getReplies().add(comment);
            } else {
                if (parent != null) {
                    cut.add(comment.getId());
                }
                roots.add(comment);
            }
        }
        return roots;
    }

    // Corrupt parent chains that loop back are cut at the first looping node in input order;
    // the rest of the loop and anything hanging off it stays attached below that node
    private static boolean closesLoop(CommentResponse comment, Map<String, CommentResponse> byId, Set<String> cut) {
        Set<String> seen = new HashSet<>();
        CommentResponse current = byId.get(comment.getParentId());
        while (current != null && !cut.contains(current.getId()) && seen.add(current.getId())) {
            if (current.getId().equals(comment.getId())) {
                return true;
            }
            current = current.getParentId() != null ? byId.get(current.getParentId()) : null;
        }
        return false;
    }

    public static int countNodes(List<CommentResponse> forest) {
        int count = 0;
        for (CommentResponse node : forest) {
            count += 1 + countNodes(node.getReplies());
        }
        return count;
    }

    public static List<Long> collectIds(List<CommentResponse> forest) {
        List<Long> ids = new ArrayList<>();
        collectIds(forest, ids);
        return ids;
    }

    private static void collectIds(List<CommentResponse> forest, Collection<Long> into) {
        for (CommentResponse node : forest) {
            into.add(Long.valueOf(node.getId()));
            collectIds(node.getReplies(), into);
        }
    }

    public static void attachLikedByMe(List<CommentResponse> forest, Set<Long> likedIds) {
        for (CommentResponse node : forest) {
            node.setLikedByMe(likedIds.contains(Long.valueOf(node.getId())));
            attachLikedByMe(node.getReplies(), likedIds);
        }
    }

    public static void attachOwnership(List<CommentResponse> forest, Set<Long> ownedIds) {
        for (CommentResponse node : forest) {
            node.setMine(ownedIds.contains(Long.valueOf(node.getId())));
            attachOwnership(node.getReplies(), ownedIds);
        }
    }
}
