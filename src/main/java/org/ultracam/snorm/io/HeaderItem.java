package org.ultracam.snorm.io;

import java.util.Objects;

/**
 * One typed entry of a frame header. The type codes are those of the ULTRACAM
 * native format, where names use '.' to build a directory hierarchy.
 *
 * <p>Value classes by type: DOUBLE {@link Double}, INT {@link Integer}, UINT
 * {@link Long}, FLOAT {@link Float}, STRING {@link String}, BOOL
 * {@link Boolean}, DIR <code>null</code>, TIME {@link Time}, DVECTOR
 * <code>double[]</code>, UCHAR {@link Byte}, USINT {@link Integer}, IVECTOR
 * <code>int[]</code>, FVECTOR <code>float[]</code>.</p>
 *
 * @author ultracam
 */
public class HeaderItem {

    public enum Type {
        DOUBLE(0), CHAR(1), INT(2), UINT(3), LINT(4), ULINT(5), FLOAT(6), STRING(7), BOOL(8), DIR(9),
        DATE(10), TIME(11), POSITION(12), DVECTOR(13), UCHAR(14), TELESCOPE(15), USINT(16), IVECTOR(17), FVECTOR(18);

        private final int code;

        Type(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }

        /**
         * Whether values of this type can be read and written.
         *
         * @return <code>false</code> for the types the native format leaves
         * unimplemented
         */
        public boolean isSupported() {
            switch (this) {
                case CHAR:
                case LINT:
                case ULINT:
                case DATE:
                case POSITION:
                case TELESCOPE:
                    return false;
                default:
                    return true;
            }
        }

        public static Type forCode(int code) {
            for (Type type : values()) {
                if (type.code == code) {
                    return type;
                }
            }
            throw new IllegalArgumentException("Unknown header item type " + code);
        }
    }

    /**
     * A time stored as an integer MJD day number plus the hour of that day.
     */
    public static class Time {

        private final int mjd;
        private final double hour;

        public Time(int mjd, double hour) {
            this.mjd = mjd;
            this.hour = hour;
        }

        public int getMjd() {
            return mjd;
        }

        public double getHour() {
            return hour;
        }

        @Override
        public String toString() {
            return "Time{" + "mjd=" + mjd + ", hour=" + hour + '}';
        }

        @Override
        public int hashCode() {
            return 31 * mjd + Double.hashCode(hour);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Time)) {
                return false;
            }
            Time other = (Time) obj;
            return mjd == other.mjd && Double.compare(hour, other.hour) == 0;
        }
    }

    private final Type type;
    private final Object value;
    private final String comment;

    public HeaderItem(Type type, Object value, String comment) {
        this.type = Objects.requireNonNull(type);
        this.value = value;
        this.comment = comment == null ? "" : comment;
    }

    public Type getType() {
        return type;
    }

    public Object getValue() {
        return value;
    }

    public String getComment() {
        return comment;
    }

    @Override
    public String toString() {
        return "HeaderItem{" + "type=" + type + ", value=" + value + ", comment=" + comment + '}';
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 53 * hash + type.hashCode();
        hash = 53 * hash + Objects.hashCode(comment);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final HeaderItem other = (HeaderItem) obj;
        return type == other.type && Objects.equals(comment, other.comment) && Objects.deepEquals(value, other.value);
    }
}
