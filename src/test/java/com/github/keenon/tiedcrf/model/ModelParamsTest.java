package com.github.keenon.tiedcrf.model;

import org.junit.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.Properties;

import static org.junit.Assert.assertEquals;

public class ModelParamsTest {

  @Test
  public void testDefaults() {
    ModelParams params = ModelParams.fromProperties(new Properties());
    assertEquals(26, params.numHiddenStates);
    assertEquals(2, params.numObservedStates);
    assertEquals(0.003, params.lambda, 0.0);
  }

  @Test
  public void testFromProperties() throws IOException {
    Properties props = new Properties();
    props.load(new StringReader("crf.numHiddenStates = 5\ncrf.numObservedStates=3\ncrf.lambda=0.5\n"));
    ModelParams params = ModelParams.fromProperties(props);
    assertEquals(5, params.numHiddenStates);
    assertEquals(3, params.numObservedStates);
    assertEquals(0.5, params.lambda, 0.0);
    assertEquals(0.0, params.withLambda(0.0).lambda, 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMalformedProperty() {
    Properties props = new Properties();
    props.setProperty(ModelParams.NUM_HIDDEN_STATES, "twenty-six");
    ModelParams.fromProperties(props);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeLambda() {
    new ModelParams(2, 2, -1.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoHiddenStates() {
    new ModelParams(0, 2, 0.0);
  }
}
