package idmapper.processing.track_post_processing;

import idmapper.data_structure.Role;

import java.util.Collections;
import java.util.List;

public class MergeByRoleResult {
    final int mergeCount;
    final List<Role> roles;

    public MergeByRoleResult(int mergeCount, List<Role> roles) {
        this.mergeCount = mergeCount;
        this.roles = Collections.unmodifiableList(roles);
    }

    public int getMergeCount() {
        return mergeCount;
    }

    /**
     * @return roles whose tracks were merged, in cast order
     */
    public List<Role> getRoles() {
        return roles;
    }

    @Override
    public String toString() {
        return mergeCount == 0 ? "no merge needed" : mergeCount+" fragments merged for: "+roles;
    }
}
