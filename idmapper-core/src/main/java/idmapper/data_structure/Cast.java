/* 
 * Copyright (C) 2025 IDMAPPER developers
 *
 * This File is part of IDMAPPER
 *
 * IDMAPPER is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * IDMAPPER is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with IDMAPPER.  If not, see <http://www.gnu.org/licenses/>.
 */
package idmapper.data_structure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Ordered set of the known entity roles. {@link Role#IGNORE} is never a cast member.
 */
public class Cast implements Iterable<Role> {
    public final static Logger logger = LoggerFactory.getLogger(Cast.class);
    public final static List<String> DEFAULT_ROLES = Collections.unmodifiableList(Arrays.asList("Target", "Confederate_1", "Confederate_2"));
    private final Set<Role> roles = new LinkedHashSet<>();

    public Cast(Collection<Role> roles) {
        for (Role r : roles) add(r);
    }

    public Cast(String... roles) {
        this(Arrays.stream(roles).map(Role::of).collect(Collectors.toList()));
    }

    public static Cast defaultCast() {
        return new Cast(DEFAULT_ROLES.toArray(new String[0]));
    }

    public synchronized boolean add(Role role) {
        if (role.isIgnore()) throw new IllegalArgumentException("\""+Role.IGNORE_NAME+"\" is reserved and cannot be a cast member");
        return roles.add(role);
    }

    public synchronized boolean remove(Role role) {
        return roles.remove(role);
    }

    public synchronized boolean contains(Role role) {
        return role != null && roles.contains(role);
    }

    public synchronized List<Role> getRoles() {
        return new ArrayList<>(roles);
    }

    public synchronized int size() {
        return roles.size();
    }

    @Override
    public Iterator<Role> iterator() {
        return getRoles().iterator();
    }

    @Override
    public String toString() {
        return getRoles().toString();
    }
}
