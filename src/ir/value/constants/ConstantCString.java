package ir.value.constants;

import ir.type.ArrayType;
import ir.type.IntegerType;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * {@code c"..."} byte string. type = [N x i8], N counts every byte including
 * a trailing NUL if there is one.
 */
public class ConstantCString extends Constant {
    private final byte[] bytes;

    public ConstantCString(byte[] bytes) {
        super(ArrayType.get(IntegerType.getI8(), bytes.length));
        this.bytes = bytes.clone();
    }

    /* the C string s, NUL terminated */
    public static ConstantCString of(String s) {
        byte[] text = s.getBytes(StandardCharsets.UTF_8);
        return new ConstantCString(Arrays.copyOf(text, text.length + 1));
    }

    public byte[] getBytes() {
        return bytes.clone();
    }

    @Override
    public boolean isNullValue() {
        for (byte b : bytes) {
            if (b != 0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String getReference() {
        StringBuilder sb = new StringBuilder("c\"");
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c >= 0x20 && c < 0x7F && c != '"' && c != '\\') {
                sb.append((char) c);
            } else {
                sb.append('\\').append(String.format("%02X", c));
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String getHash() {
        return "CSTRING" + getType().getHash() + Arrays.toString(bytes);
    }
}
