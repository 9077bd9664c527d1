package com.hdrmerge.core.bracket;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * One complete group of exposures that merges into a single HDR image.
 */
public record BracketSet(int index, List<BracketMember> members) {

    public BracketSet {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        members = List.copyOf(members);
    }

    public List<Path> files() {
        return members.stream().map(BracketMember::file).toList();
    }

    /**
     * Points the set at replacement files (for instance aligned copies) while keeping every
     * position's EV offset.
     */
    public BracketSet withFiles(List<Path> replacements) {
        if (replacements.size() != members.size()) {
            throw new IllegalArgumentException("expected " + members.size() + " files but got " + replacements.size());
        }
        List<BracketMember> moved = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            moved.add(new BracketMember(replacements.get(i), members.get(i).evOffset()));
        }
        return new BracketSet(index, moved);
    }

    public int size() {
        return members.size();
    }
}
