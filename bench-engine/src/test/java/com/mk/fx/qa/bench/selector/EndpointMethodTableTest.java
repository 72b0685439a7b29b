package com.mk.fx.qa.bench.selector;

import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.bench.rest.HttpMethod;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EndpointMethodTableTest {

  private final EndpointMethodTable table =
      new EndpointMethodTable(List.of("/deposit", "/withdraw"));

  @Test
  void mutatingEndpoints_arePostWithAmountPayload() {
    EndpointCall call = table.resolve("/deposit");

    assertEquals(HttpMethod.POST, call.method());
    assertEquals(Map.of("amount", 1), call.body());
    assertEquals("/deposit", call.endpoint());
  }

  @Test
  void otherEndpoints_areBodilessGet() {
    EndpointCall call = table.resolve("/factorial/10");

    assertEquals(HttpMethod.GET, call.method());
    assertNull(call.body());
  }

  @Test
  void matchingIsExact() {
    assertEquals(HttpMethod.GET, table.resolve("/deposit/").method());
    assertEquals(HttpMethod.GET, table.resolve("/DEPOSIT").method());
  }

  @Test
  void tableIsConfigurable() {
    var custom = new EndpointMethodTable(List.of("/orders"));

    assertEquals(HttpMethod.POST, custom.resolve("/orders").method());
    assertEquals(HttpMethod.GET, custom.resolve("/deposit").method());
    assertEquals(HttpMethod.GET, new EndpointMethodTable(null).resolve("/deposit").method());
  }
}
