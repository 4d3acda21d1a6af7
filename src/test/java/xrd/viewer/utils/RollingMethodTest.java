package xrd.viewer.utils;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class RollingMethodTest {

  @Test
  public void fromName_acceptsDisplayAndConstantNames() {
    assertEquals(RollingMethod.MIN, RollingMethod.fromName("Min"));
    assertEquals(RollingMethod.MEDIAN, RollingMethod.fromName(" median "));
    assertEquals(RollingMethod.MEDIAN, RollingMethod.fromName("MEDIAN"));
  }

  @Test(expected = InvalidParameterException.class)
  public void fromName_unknown_rejected() {
    RollingMethod.fromName("Max");
  }

  @Test(expected = InvalidParameterException.class)
  public void fromName_null_rejected() {
    RollingMethod.fromName(null);
  }

}
