package io.wfpath.query;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import io.wfpath.query.FallbackResolver.Resolution;
import io.wfpath.query.FallbackResolver.State;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FallbackResolverTest {

  @Mock private CountFunction counter;

  private FallbackResolver resolver;

  @BeforeEach
  void setUp() {
    resolver = new FallbackResolver(counter, TypeRegistry.builtins());
  }

  @Test
  void fallsBackToWorkflowIdPrefix() throws Exception {
    when(counter.count("WorkflowType = 'Foo'")).thenReturn(0L);
    when(counter.count("WorkflowId STARTS_WITH 'Foo'")).thenReturn(3L);

    Resolution r = resolver.resolve("WorkflowType = 'Foo'");

    assertEquals(State.FALLBACK_BY_ID, r.state());
    assertEquals(3L, r.count());
    assertEquals("WorkflowId STARTS_WITH 'Foo'", r.query());
    assertEquals(List.of("WorkflowType = 'Foo'", "WorkflowId STARTS_WITH 'Foo'"), r.attempted());
    assertTrue(r.found());
    assertTrue(r.fallbackUsed());
  }

  @Test
  void primaryHitDoesNotFallBack() throws Exception {
    when(counter.count("WorkflowType = 'Foo'")).thenReturn(7L);

    Resolution r = resolver.resolve(new QueryBuilder().workflowType("Foo").build());

    assertEquals(State.PRIMARY, r.state());
    assertEquals(7L, r.count());
    verify(counter, times(1)).count(anyString());
  }

  @Test
  void bothEmptyReportsBothQueries() throws Exception {
    when(counter.count(anyString())).thenReturn(0L);

    Resolution r = resolver.resolve("WorkflowType = 'Foo'");

    assertEquals(State.PRIMARY, r.state());
    assertEquals(0L, r.count());
    assertFalse(r.found());
    assertEquals(2, r.attempted().size());
    verify(counter, times(2)).count(anyString());
    Map<String, Object> map = r.toMap();
    assertTrue(((String) map.get("message")).contains("WorkflowId STARTS_WITH 'Foo'"));
  }

  @Test
  void compoundQueriesAreNotRewritten() throws Exception {
    when(counter.count(anyString())).thenReturn(0L);

    Resolution r = resolver.resolve("WorkflowType = 'Foo' AND ExecutionStatus = 'Failed'");

    assertEquals(State.PRIMARY, r.state());
    assertEquals(1, r.attempted().size());
    verify(counter, times(1)).count(anyString());
  }

  @Test
  void otherOperatorsAreNotRewritten() throws Exception {
    when(counter.count(anyString())).thenReturn(0L);

    resolver.resolve("WorkflowType STARTS_WITH 'Foo'");

    verify(counter, times(1)).count(anyString());
  }

  @Test
  void unparseableQueriesAreCountedAsGiven() throws Exception {
    when(counter.count("WorkflowType LIKE 'Foo%'")).thenReturn(0L);

    Resolution r = resolver.resolve("WorkflowType LIKE 'Foo%'");

    assertEquals(State.PRIMARY, r.state());
    assertEquals(List.of("WorkflowType LIKE 'Foo%'"), r.attempted());
    verify(counter, times(1)).count(anyString());
  }

  @Test
  void counterFailuresPropagate() throws Exception {
    when(counter.count(anyString())).thenThrow(new IllegalStateException("boom"));

    assertThrows(IllegalStateException.class, () -> resolver.resolve("WorkflowType = 'Foo'"));
  }

  @Test
  void eligibility() {
    TypeRegistry r = TypeRegistry.builtins();
    assertTrue(FallbackResolver.eligible(QueryParser.parse("WorkflowType = 'X'", r)));
    assertFalse(FallbackResolver.eligible(QueryParser.parse("WorkflowType != 'X'", r)));
    assertFalse(FallbackResolver.eligible(QueryParser.parse("WorkflowId = 'X'", r)));
    assertTrue(FallbackResolver.eligible(QueryParser.parse("(WorkflowType = 'X')", r)));
  }
}
