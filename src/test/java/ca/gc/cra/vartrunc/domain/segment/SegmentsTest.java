package ca.gc.cra.vartrunc.domain.segment;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.vartrunc.domain.value.ArrayValue;
import ca.gc.cra.vartrunc.domain.value.BooleanValue;
import ca.gc.cra.vartrunc.domain.value.FloatValue;
import ca.gc.cra.vartrunc.domain.value.IntegerValue;
import ca.gc.cra.vartrunc.domain.value.NullValue;
import ca.gc.cra.vartrunc.domain.value.ObjectValue;
import ca.gc.cra.vartrunc.domain.value.StringValue;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class SegmentsTest {

  @Test
  void wrapsValuesInTheirNaturalSegment() {
    assertEquals(SegmentType.STRING, Segments.of(StringValue.of("a")).type());
    assertEquals(SegmentType.INTEGER, Segments.of(IntegerValue.of(1)).type());
    assertEquals(SegmentType.INTEGER, Segments.of(BooleanValue.TRUE).type());
    assertEquals(SegmentType.FLOAT, Segments.of(FloatValue.of(1.5)).type());
    assertSame(NoneSegment.INSTANCE, Segments.of(NullValue.INSTANCE));
    assertEquals(SegmentType.ARRAY, Segments.of(ArrayValue.EMPTY).type());
    assertEquals(SegmentType.OBJECT, Segments.of(ObjectValue.EMPTY).type());
  }

  @Test
  void unwrapsValueBackedSegments() {
    StringValue text = StringValue.of("abc");

    assertEquals(text, Segments.valueOf(new StringSegment(text)));
    assertEquals(NullValue.INSTANCE, Segments.valueOf(NoneSegment.INSTANCE));
  }

  @Test
  void fileSegmentsCarryNoValue() {
    FileReference file = new FileReference("f-1", "report.pdf", Optional.of("application/pdf"), 120);

    assertNull(Segments.valueOf(new FileSegment(file)));
    assertNull(Segments.valueOf(new ArrayFileSegment(List.of(file))));
  }

  @Test
  void integerSegmentRejectsOtherKinds() {
    assertThrows(IllegalArgumentException.class, () -> new IntegerSegment(StringValue.of("1")));
  }

  @Test
  void fileReferenceRejectsNegativeSize() {
    assertThrows(IllegalArgumentException.class,
        () -> new FileReference("f-1", "a.txt", Optional.empty(), -1));
  }
}
