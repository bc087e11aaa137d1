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

/**
 * Human-assigned entity label of a track.
 * Names are trimmed and never blank; {@link #IGNORE} marks a track that does not represent an entity of interest.
 */
public final class Role implements Comparable<Role> {
    public final static String IGNORE_NAME = "Ignore";
    public final static Role IGNORE = new Role(IGNORE_NAME);
    private final String name;

    private Role(String name) {
        this.name = name;
    }

    /**
     * @param name role name
     * @return the role named {@code name}
     * @throws IllegalArgumentException if {@code name} is null or blank
     */
    public static Role of(String name) {
        if (name == null || name.trim().isEmpty()) throw new IllegalArgumentException("Role name cannot be empty");
        String n = name.trim();
        if (IGNORE_NAME.equals(n)) return IGNORE;
        return new Role(n);
    }

    /**
     * Lenient version of {@link #of(String)} used when reading files: null, blank and "None" map to {@link #IGNORE}
     * @param name role name, possibly null
     * @return role
     */
    public static Role parse(String name) {
        if (name == null || name.trim().isEmpty() || "None".equals(name.trim())) return IGNORE;
        return of(name);
    }

    public String getName() {
        return name;
    }

    public boolean isIgnore() {
        return IGNORE_NAME.equals(name);
    }

    @Override
    public int compareTo(Role o) {
        return name.compareTo(o.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Role)) return false;
        return name.equals(((Role) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
