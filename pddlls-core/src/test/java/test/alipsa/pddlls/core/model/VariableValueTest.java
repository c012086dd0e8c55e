package test.alipsa.pddlls.core.model;

import org.junit.jupiter.api.Test;
import se.alipsa.pddlls.core.model.Parameter;
import se.alipsa.pddlls.core.model.Variable;
import se.alipsa.pddlls.core.model.VariableValue;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VariableValueTest {

  @Test
  void wrongKindAccess_isAContractError() {
    VariableValue fact = VariableValue.of("at t1 depot", true);
    assertTrue(fact.getBooleanValue());
    assertThrows(IllegalStateException.class, fact::getNumericValue);

    VariableValue fuel = VariableValue.of("fuel t1", 10.5);
    assertEquals(10.5, fuel.getNumericValue());
    assertThrows(IllegalStateException.class, fuel::getBooleanValue);
  }

  @Test
  void negate() {
    assertFalse(VariableValue.of("p", true).negate("(not (p))").getBooleanValue());
    VariableValue negatedNumber = VariableValue.of("f", 1).negate("(not (= (f) 1))");
    assertFalse(negatedNumber.isSupported());
    assertEquals("(not (= (f) 1))", negatedNumber.getVerbatim());
  }

  @Test
  void variableEquality_isCaseInsensitiveAndCountsParameters() {
    Variable a = new Variable("At", List.of(new Parameter("t", "truck"), new Parameter("l", "location")));
    Variable b = new Variable("at", List.of(new Parameter("x", "object"), new Parameter("y", "object")));
    Variable c = new Variable("at", List.of(new Parameter("x", "object")));
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
    assertEquals("At ?t - truck ?l - location", a.getFullName());
  }
}
