package com.lyshra.open.objects.core.id;

/**
 * Identifier of a node (member) of the cluster.
 */
public final class NodeId extends BaseId {

    public static final int SIZE = 28;

    private static final NodeId NIL = new NodeId(nilBytes(SIZE));

    private NodeId(byte[] id) {
        super(id, SIZE);
    }

    /**
     * Creates an id from its binary form. An empty array yields the nil id.
     *
     * @param binary the raw id bytes
     * @return the id
     * @throws IllegalArgumentException if the array is neither empty nor {@value #SIZE} bytes long
     */
    public static NodeId fromBinary(byte[] binary) {
        if (binary == null || binary.length == 0) {
            return NIL;
        }
        return new NodeId(binary);
    }

    public static NodeId fromHex(String hex) {
        return new NodeId(hexBytes(hex));
    }

    public static NodeId fromRandom() {
        return new NodeId(randomBytes(SIZE));
    }

    public static NodeId nil() {
        return NIL;
    }
}
