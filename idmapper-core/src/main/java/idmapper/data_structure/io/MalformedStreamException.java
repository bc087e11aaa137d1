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
package idmapper.data_structure.io;

import java.io.IOException;

/**
 * The detection stream could not be parsed to its end. Nothing parsed so far is committed.
 */
public class MalformedStreamException extends IOException {
    final int line;

    public MalformedStreamException(String message, int line) {
        super(line > 0 ? message+" (line "+line+")" : message);
        this.line = line;
    }

    public MalformedStreamException(String message, int line, Throwable cause) {
        super(line > 0 ? message+" (line "+line+")" : message, cause);
        this.line = line;
    }

    /**
     * @return 1-based line number where parsing failed, or 0 if the failure is not tied to a line
     */
    public int getLine() {
        return line;
    }
}
