package com.layeredcrf.server.crf.graph;

/**
 * Selects the edges a bulk potential write applies to: either every edge, or
 * only the edges carrying one group id.
 */
public final class GroupFilter {

    private static final GroupFilter ALL = new GroupFilter(-1);

    // -1 marks the "all groups" branch
    private final int group;

    private GroupFilter(int group) {
        this.group = group;
    }

    public static GroupFilter all() {
        return ALL;
    }

    public static GroupFilter of(int group) {
        if (group < 0) {
            throw new IllegalArgumentException("Edge group must be non-negative: " + group);
        }
        return new GroupFilter(group);
    }

    public boolean isAll() {
        return group < 0;
    }

    /**
     * @throws IllegalStateException for the {@link #all()} filter, which has no
     *                               single group
     */
    public int getGroup() {
        if (isAll()) {
            throw new IllegalStateException("GroupFilter.all() has no group id");
        }
        return group;
    }

    public boolean matches(int edgeGroup) {
        return isAll() || edgeGroup == group;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GroupFilter)) {
            return false;
        }
        return group == ((GroupFilter) o).group;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(group);
    }

    @Override
    public String toString() {
        return isAll() ? "GroupFilter{all}" : "GroupFilter{group=" + group + "}";
    }
}
