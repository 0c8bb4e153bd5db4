package com.starscape.phototriage.features.grouprules.app;

import com.starscape.phototriage.features.hashing.domain.HashCodec;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Primary and secondary hash distances between every pair of members of one group.
 * A secondary distance of -1 means one side has no secondary hash.
 */
public final class DistanceTable {
    
    public static final int UNKNOWN = -1;
    
    private final Map<String, Integer> index = new HashMap<>();
    private final int[][] primary;
    private final int[][] secondary;
    
    private DistanceTable(List<GroupMember> members) {
        int n = members.size();
        primary = new int[n][n];
        secondary = new int[n][n];
        for (int i = 0; i < n; i++) {
            GroupMember a = members.get(i);
            if (index.put(a.photoId(), i) != null) {
                throw new IllegalArgumentException("Photo " + a.photoId() + " listed twice in one group");
            }
            secondary[i][i] = a.secondary() == null ? UNKNOWN : 0;
            for (int j = 0; j < i; j++) {
                GroupMember b = members.get(j);
                int p = HashCodec.distance(a.primary(), b.primary());
                int s = a.secondary() != null && b.secondary() != null
                    ? HashCodec.distance(a.secondary(), b.secondary())
                    : UNKNOWN;
                primary[i][j] = primary[j][i] = p;
                secondary[i][j] = secondary[j][i] = s;
            }
        }
    }
    
    public static DistanceTable of(List<GroupMember> members) {
        return new DistanceTable(members);
    }
    
    public int primary(GroupMember a, GroupMember b) {
        return primary[indexOf(a)][indexOf(b)];
    }
    
    public int secondary(GroupMember a, GroupMember b) {
        return secondary[indexOf(a)][indexOf(b)];
    }
    
    private int indexOf(GroupMember member) {
        Integer i = index.get(member.photoId());
        if (i == null) {
            throw new IllegalArgumentException("Photo " + member.photoId() + " is not in this group");
        }
        return i;
    }
}
