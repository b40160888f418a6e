package com.tsquery.backend.table;

import java.util.Locale;

import com.google.common.primitives.UnsignedLong;
import com.google.common.primitives.UnsignedLongs;

import com.tsquery.common.exception.ConfigurationException;

/**
 * 列的语义类型。
 * <p>
 * 单元格取值约定：INT / UINT / TIME / DURATION 均为 {@link Long}
 * （TIME 为纪元纳秒，DURATION 为纳秒，UINT 按无符号解释 long 的比特位），
 * FLOAT 为 {@link Double}，STRING 为 {@link String}，BOOL 为 {@link Boolean}。
 * 任何列都允许 null。
 * </p>
 */
public enum ColumnType {
    INT {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Long;
        }

        @Override
        public int compare(Object left, Object right) {
            return Long.compare((Long) left, (Long) right);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double toDouble(Object value) {
            return (double) (Long) value;
        }
    },

    UINT {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Long;
        }

        @Override
        public int compare(Object left, Object right) {
            return UnsignedLongs.compare((Long) left, (Long) right);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double toDouble(Object value) {
            return UnsignedLong.fromLongBits((Long) value).doubleValue();
        }

        @Override
        public String format(Object value) {
            return value == null ? "" : UnsignedLongs.toString((Long) value);
        }
    },

    FLOAT {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Double;
        }

        @Override
        public int compare(Object left, Object right) {
            return Double.compare((Double) left, (Double) right);
        }

        @Override
        public boolean isNumeric() {
            return true;
        }

        @Override
        public double toDouble(Object value) {
            return (Double) value;
        }
    },

    STRING {
        @Override
        public boolean accepts(Object value) {
            return value instanceof String;
        }

        @Override
        public int compare(Object left, Object right) {
            return ((String) left).compareTo((String) right);
        }
    },

    BOOL {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Boolean;
        }

        @Override
        public int compare(Object left, Object right) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
    },

    TIME {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Long;
        }

        @Override
        public int compare(Object left, Object right) {
            return Long.compare((Long) left, (Long) right);
        }
    },

    DURATION {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Long;
        }

        @Override
        public int compare(Object left, Object right) {
            return Long.compare((Long) left, (Long) right);
        }
    };

    /** 值是否符合本类型的 Java 表示（null 不在此判断） */
    public abstract boolean accepts(Object value);

    public abstract int compare(Object left, Object right);

    public boolean isNumeric() {
        return false;
    }

    /**
     * 数值类型拓宽为 double，用于聚合计算。
     */
    public double toDouble(Object value) {
        throw new UnsupportedOperationException("column type " + this + " is not numeric");
    }

    public String format(Object value) {
        return value == null ? "" : String.valueOf(value);
    }

    /**
     * 从类型名解析 ColumnType，大小写不敏感
     */
    public static ColumnType from(String s) {
        if(s == null) {
            throw new ConfigurationException("column type is null");
        }
        try {
            // "float" -> "FLOAT" -> ColumnType.FLOAT
            return ColumnType.valueOf(s.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("unknown column type " + s);
        }
    }
}
