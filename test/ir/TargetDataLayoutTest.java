package ir;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import exception.CompileException;
import ir.type.ArrayType;
import ir.type.FloatType;
import ir.type.IntegerType;
import ir.type.PointerType;
import ir.type.StructType;
import ir.type.VoidType;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link TargetDataLayout}. */
@RunWith(JUnit4.class)
public class TargetDataLayoutTest {
    private static final String X86_64 =
            "e-m:e-p270:32:32-p271:32:32-p272:64:64-i64:64-f80:128-n8:16:32:64-S128";
    private static final String I386 =
            "e-m:e-p:32:32-p270:32:32-p271:32:32-p272:64:64-f64:32:64-f80:32-n8:16:32-S128";

    @Test
    public void defaults() {
        TargetDataLayout layout = TargetDataLayout.getDefault();

        assertThat(layout.getPointerSizeInBits()).isEqualTo(64);
        assertThat(layout.getSizeType()).isEqualTo(IntegerType.getI64());
        assertThat(layout.isBigEndian()).isFalse();
        // i64 is only 4-byte aligned unless the string says otherwise
        assertThat(layout.getABITypeAlignment(IntegerType.getI64())).isEqualTo(4);
    }

    @Test
    public void x86_64() {
        TargetDataLayout layout = TargetDataLayout.parse(X86_64);

        // p270 and friends are other address spaces and leave the default pointer alone
        assertThat(layout.getPointerSizeInBits()).isEqualTo(64);
        assertThat(layout.getSizeType()).isEqualTo(IntegerType.getI64());
        assertThat(layout.getTypeAllocSize(IntegerType.getI1())).isEqualTo(1);
        assertThat(layout.getTypeAllocSize(IntegerType.getI32())).isEqualTo(4);
        assertThat(layout.getABITypeAlignment(IntegerType.getI64())).isEqualTo(8);
        assertThat(layout.getTypeAllocSize(PointerType.getBytePtr())).isEqualTo(8);
        assertThat(layout.getTypeAllocSize(FloatType.getDouble())).isEqualTo(8);
    }

    @Test
    public void thirtyTwoBitPointers() {
        TargetDataLayout layout = TargetDataLayout.parse(I386);

        assertThat(layout.getPointerSizeInBits()).isEqualTo(32);
        assertThat(layout.getSizeType()).isEqualTo(IntegerType.getI32());
        assertThat(layout.getTypeAllocSize(PointerType.getBytePtr())).isEqualTo(4);
        assertThat(layout.getABITypeAlignment(FloatType.getDouble())).isEqualTo(4);
    }

    @Test
    public void structPadding() {
        TargetDataLayout layout = TargetDataLayout.parse(X86_64);
        StructType s = StructType.getLiteral(
                List.of(IntegerType.getI8(), IntegerType.getI32(), IntegerType.getI8()), false);

        assertThat(layout.getStructFieldOffsets(s)).asList().containsExactly(0L, 4L, 8L).inOrder();
        assertThat(layout.getTypeAllocSize(s)).isEqualTo(12);
        assertThat(layout.getABITypeAlignment(s)).isEqualTo(4);
    }

    @Test
    public void packedStruct() {
        TargetDataLayout layout = TargetDataLayout.parse(X86_64);
        StructType s = StructType.getLiteral(List.of(IntegerType.getI8(), IntegerType.getI32()), true);

        assertThat(layout.getStructFieldOffsets(s)).asList().containsExactly(0L, 1L).inOrder();
        assertThat(layout.getTypeAllocSize(s)).isEqualTo(5);
    }

    @Test
    public void arrays() {
        TargetDataLayout layout = TargetDataLayout.parse(X86_64);
        StructType pair = StructType.getLiteral(List.of(IntegerType.getI64(), IntegerType.getI8()), false);

        assertThat(layout.getTypeAllocSize(ArrayType.get(IntegerType.getI32(), 10))).isEqualTo(40);
        assertThat(layout.getTypeAllocSize(ArrayType.get(pair, 3))).isEqualTo(48);
        assertThat(layout.getTypeAllocSize(ArrayType.get(IntegerType.getI8(), 0))).isEqualTo(0);
    }

    @Test
    public void unsizedTypesThrow() {
        TargetDataLayout layout = TargetDataLayout.getDefault();
        StructType opaque = StructType.createIdentified("struct.opaque");

        assertThrows(CompileException.class, () -> layout.getTypeAllocSize(opaque));
        assertThrows(CompileException.class, () -> layout.getTypeAllocSize(VoidType.getVoid()));
    }

    @Test
    public void malformedEntry() {
        CompileException e = assertThrows(CompileException.class, () -> TargetDataLayout.parse("e-i64:x"));

        assertThat(e).hasMessageThat().contains("i64:x");
    }
}
