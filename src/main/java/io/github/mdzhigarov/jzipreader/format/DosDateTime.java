/*
 * Copyright 2024 mdzhigarov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.mdzhigarov.jzipreader.format;

import java.time.LocalDateTime;

/**
 * MS-DOS packed date and time, as stored in local and central directory headers. Two 16-bit
 * words, time first:
 *
 * <pre>
 * time: bits 11-15 hour, bits 5-10 minute, bits 0-4 second / 2
 * date: bits  9-15 year - 1980, bits 5-8 month, bits 0-4 day
 * </pre>
 *
 * <p>Seconds have a resolution of two; an odd second is rounded down when packed.
 */
public final class DosDateTime {

    public static final DosDateTime ZERO = new DosDateTime(0, 0);

    public static final int YEAR_BASE = 1980;

    private static final int HOUR_SHIFT = 11;
    private static final int HOUR_MASK = 0b11111;
    private static final int MINUTE_SHIFT = 5;
    private static final int MINUTE_MASK = 0b111111;
    private static final int SECOND_MASK = 0b11111;

    private static final int YEAR_SHIFT = 9;
    private static final int YEAR_MASK = 0b1111111;
    private static final int MONTH_SHIFT = 5;
    private static final int MONTH_MASK = 0b1111;
    private static final int DAY_MASK = 0b11111;

    private final int time;
    private final int date;

    private DosDateTime(int time, int date) {
        this.time = time;
        this.date = date;
    }

    /**
     * Wraps raw words read from an archive. Each word must fit in 16 bits. No calendar check:
     * archives in the wild carry zero dates and other values no calendar accepts.
     */
    public static DosDateTime fromWords(int time, int date) {
        checkWord("time", time);
        checkWord("date", date);
        return new DosDateTime(time, date);
    }

    public static DosDateTime of(int year, int month, int day, int hour, int minute, int second) {
        checkRange("year", year, YEAR_BASE, YEAR_BASE + YEAR_MASK);
        checkRange("month", month, 1, 12);
        checkRange("day", day, 1, 31);
        checkRange("hour", hour, 0, 23);
        checkRange("minute", minute, 0, 59);
        checkRange("second", second, 0, 59);

        int time = (hour << HOUR_SHIFT) | (minute << MINUTE_SHIFT) | (second >> 1);
        int date = ((year - YEAR_BASE) << YEAR_SHIFT) | (month << MONTH_SHIFT) | day;
        return new DosDateTime(time, date);
    }

    public static DosDateTime fromLocalDateTime(LocalDateTime dateTime) {
        return of(dateTime.getYear(), dateTime.getMonthValue(), dateTime.getDayOfMonth(),
                dateTime.getHour(), dateTime.getMinute(), dateTime.getSecond());
    }

    public int getYear() {
        return ((date >> YEAR_SHIFT) & YEAR_MASK) + YEAR_BASE;
    }

    public int getMonth() {
        return (date >> MONTH_SHIFT) & MONTH_MASK;
    }

    public int getDay() {
        return date & DAY_MASK;
    }

    public int getHour() {
        return (time >> HOUR_SHIFT) & HOUR_MASK;
    }

    public int getMinute() {
        return (time >> MINUTE_SHIFT) & MINUTE_MASK;
    }

    public int getSecond() {
        return (time & SECOND_MASK) << 1;
    }

    /**
     * @return the raw 16-bit time word
     */
    public int getTimeWord() {
        return time;
    }

    /**
     * @return the raw 16-bit date word
     */
    public int getDateWord() {
        return date;
    }

    /**
     * @return both words as one 32-bit value, date in the high half
     */
    public long toPacked() {
        return ((long) date << 16) | time;
    }

    /**
     * @throws java.time.DateTimeException if the packed fields do not form a valid date,
     *                                      e.g. for {@link #ZERO}
     */
    public LocalDateTime toLocalDateTime() {
        return LocalDateTime.of(getYear(), getMonth(), getDay(), getHour(), getMinute(), getSecond());
    }

    private static void checkWord(String name, int value) {
        if (value < 0 || value > 0xFFFF) {
            throw new IllegalArgumentException(name + " word out of 16-bit range: " + value);
        }
    }

    private static void checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " " + value + " outside [" + min + ", " + max + "]");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DosDateTime)) {
            return false;
        }
        DosDateTime other = (DosDateTime) o;
        return time == other.time && date == other.date;
    }

    @Override
    public int hashCode() {
        return (date << 16) ^ time;
    }

    @Override
    public String toString() {
        return String.format("%d-%02d-%02d %02d:%02d:%02d",
                getYear(), getMonth(), getDay(), getHour(), getMinute(), getSecond());
    }
}
