package com.family.library.conversation;

import com.family.library.entity.Participant;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides who reads next.
 * <ul>
 *   <li>children take turns in name order;</li>
 *   <li>after the last child a parent is suggested (the first two, as "A or B");</li>
 *   <li>after a parent the cycle restarts with the first child;</li>
 *   <li>no history, or a reader nobody knows, also restarts with the first child.</li>
 * </ul>
 * Returns an empty string when there are no children at all.
 */
public final class RotationCalculator {

    private RotationCalculator() {
    }

    public static String nextParticipant(List<Participant> participants, String lastParticipantName) {
        if (participants == null || participants.isEmpty()) {
            return "";
        }

        List<String> children = new ArrayList<>();
        List<String> parents = new ArrayList<>();
        for (Participant p : participants) {
            if (p.isParent()) {
                parents.add(p.getName());
            } else {
                children.add(p.getName());
            }
        }
        if (children.isEmpty()) {
            return "";
        }
        Collections.sort(children);
        Collections.sort(parents);

        String last = lastParticipantName == null ? "" : lastParticipantName;
        if (last.isEmpty() || parents.contains(last)) {
            return children.get(0);
        }

        int idx = children.indexOf(last);
        if (idx < 0) {
            return children.get(0);
        }
        if (idx < children.size() - 1) {
            return children.get(idx + 1);
        }
        if (parents.isEmpty()) {
            return children.get(0);
        }
        if (parents.size() == 1) {
            return parents.get(0);
        }
        return parents.get(0) + " or " + parents.get(1);
    }
}
