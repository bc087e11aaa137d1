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
package idmapper.core;

import org.slf4j.Logger;

/**
 *
 * Progress feedback of long operations (loading, bulk engines)
 */
public interface ProgressCallback {
    void incrementTaskNumber(int subtask);
    void setTaskNumber(int number);
    void incrementProgress();
    void log(String message);
    void setProgress(int i);
    int getTaskNumber();
    void setRunning(boolean running);

    ProgressCallback NONE = new ProgressCallback() {
        @Override public void incrementTaskNumber(int subtask) {}
        @Override public void setTaskNumber(int number) {}
        @Override public void incrementProgress() {}
        @Override public void log(String message) {}
        @Override public void setProgress(int i) {}
        @Override public int getTaskNumber() {return 0;}
        @Override public void setRunning(boolean running) {}
    };

    /**
     * @param logger destination of messages and progress
     * @return callback forwarding messages at info level and progress at debug level
     */
    static ProgressCallback get(Logger logger) {
        return new ProgressCallback() {
            int taskCounter = 0;
            int taskNumber = 0;

            @Override
            public synchronized void incrementTaskNumber(int subtask) {
                taskNumber += subtask;
            }

            @Override
            public synchronized void setTaskNumber(int number) {
                taskNumber = number;
                taskCounter = 0;
            }

            @Override
            public synchronized void incrementProgress() {
                ++taskCounter;
                if (taskNumber > 0) logger.debug("progress: {}%", 100 * taskCounter / taskNumber);
            }

            @Override
            public void log(String message) {
                logger.info(message);
            }

            @Override
            public synchronized void setProgress(int i) {
                taskCounter = i;
                if (taskNumber > 0) logger.debug("progress: {}%", 100 * taskCounter / taskNumber);
            }

            @Override
            public synchronized int getTaskNumber() {
                return taskNumber;
            }

            @Override
            public void setRunning(boolean running) {
                logger.debug("running: {}", running);
            }
        };
    }
}
