package com.routing.core;

import java.util.Comparator;
import java.util.Objects;

/**
 * Two-part grouping key of a route record: claim id and status code.
 * Ordered by claim id, then status code, each compared by Unicode code point.
 */
public final class GroupKey implements Comparable<GroupKey> {

    private static final Comparator<String> CODE_POINT_ORDER = GroupKey::compareByCodePoint;

    private static final Comparator<GroupKey> ORDER = Comparator
        .comparing(GroupKey::getClaimId, CODE_POINT_ORDER)
        .thenComparing(GroupKey::getStatusCode, CODE_POINT_ORDER);

    private final String claimId;
    private final String statusCode;

    public GroupKey(String claimId, String statusCode) {
        this.claimId = Objects.requireNonNull(claimId, "claimId");
        this.statusCode = Objects.requireNonNull(statusCode, "statusCode");
    }

    public String getClaimId() {
        return claimId;
    }

    public String getStatusCode() {
        return statusCode;
    }

    /**
     * Compares code points rather than UTF-16 units, so characters above U+FFFF
     * sort after every BMP character.
     */
    static int compareByCodePoint(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

    @Override
    public int compareTo(GroupKey o) {
        return ORDER.compare(this, o);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj instanceof GroupKey) {
            GroupKey o = (GroupKey) obj;
            return claimId.equals(o.claimId) && statusCode.equals(o.statusCode);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * claimId.hashCode() + statusCode.hashCode();
    }

    @Override
    public String toString() {
        return claimId + "," + statusCode;
    }
}
