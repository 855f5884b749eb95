package rmq;

import java.util.List;

/**
 * Central place to construct RMQ structures, including from untyped input such as
 * decoded JSON. Accepted sequences are {@code double[]}, {@code float[]} and
 * {@code List} of {@link Number}.
 */
public final class RmqFactory {

    private RmqFactory() {}

    public static RangeMinimumQuery create(RmqType type, double[] values) {
        return type.build(values);
    }

    public static RangeMinimumQuery create(RmqType type, Object sequence) {
        return type.build(toDoubleArray(sequence));
    }

    // Converts a sequence container to a primitive array; rejects anything else as INVALID_TYPE.
    static double[] toDoubleArray(Object sequence) {
        if (sequence instanceof double[] arr) {
            return arr;
        }
        if (sequence instanceof float[] arr) {
            double[] out = new double[arr.length];
            for (int i = 0; i < arr.length; i++) out[i] = arr[i];
            return out;
        }
        if (sequence instanceof List<?> list) {
            double[] out = new double[list.size()];
            int i = 0;
            for (Object element : list) {
                if (!(element instanceof Number number)) {
                    throw RmqException.invalidType("Element " + i + " is not a number: " + element);
                }
                out[i++] = number.doubleValue();
            }
            return out;
        }
        throw RmqException.invalidType("Input array must be of type list, got "
                + (sequence == null ? "null" : sequence.getClass().getSimpleName()) + ".");
    }
}
