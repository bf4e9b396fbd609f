package diffstore.codec;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ValueCodecTest {

  @Test
  void getDefaultFailsWithoutRegisteredCodec() {
    IllegalStateException e = assertThrows(IllegalStateException.class, ValueCodec::getDefault);
    assertTrue(e.getMessage().contains("diffstore-jackson"));
  }
}
