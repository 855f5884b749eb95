package rmq;

/**
 * Boundary for callers whose arguments are untyped (decoded JSON, scripted workloads).
 * Indices must be integral boxed numbers and values floating boxed numbers;
 * anything else fails with INVALID_TYPE before the structure is touched.
 */
public final class RmqArguments {

    private RmqArguments() {}

    public static void update(RangeMinimumQuery rmq, Object index, Object value) {
        if (!isIntegral(index)) {
            throw RmqException.invalidType("Index must be an integer, got " + describe(index) + ".");
        }
        if (!(value instanceof Double || value instanceof Float)) {
            throw RmqException.invalidType("New value must be a float, got " + describe(value) + ".");
        }
        rmq.update(toIndex(index), ((Number) value).doubleValue());
    }

    public static double query(RangeMinimumQuery rmq, Object left, Object right) {
        if (!isIntegral(left) || !isIntegral(right)) {
            throw RmqException.invalidType("Both left and right indices must be integers, got "
                    + describe(left) + " and " + describe(right) + ".");
        }
        return rmq.query(toIndex(left), toIndex(right));
    }

    private static boolean isIntegral(Object o) {
        return o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte;
    }

    // Longs beyond the int range can never be valid positions.
    private static int toIndex(Object o) {
        long v = ((Number) o).longValue();
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            throw RmqException.indexOutOfBounds("Index " + v + " is out of bounds.");
        }
        return (int) v;
    }

    private static String describe(Object o) {
        return o == null ? "null" : o.getClass().getSimpleName();
    }
}
