package com.lyshra.open.objects.core.id;

/**
 * Identifier of a logical data object tracked by the cluster.
 */
public final class ObjectId extends BaseId {

    public static final int SIZE = 28;

    private static final ObjectId NIL = new ObjectId(nilBytes(SIZE));

    private ObjectId(byte[] id) {
        super(id, SIZE);
    }

    /**
     * Creates an id from its binary form. An empty array yields the nil id.
     *
     * @param binary the raw id bytes
     * @return the id
     * @throws IllegalArgumentException if the array is neither empty nor {@value #SIZE} bytes long
     */
    public static ObjectId fromBinary(byte[] binary) {
        if (binary == null || binary.length == 0) {
            return NIL;
        }
        return new ObjectId(binary);
    }

    public static ObjectId fromHex(String hex) {
        return new ObjectId(hexBytes(hex));
    }

    public static ObjectId fromRandom() {
        return new ObjectId(randomBytes(SIZE));
    }

    public static ObjectId nil() {
        return NIL;
    }
}
