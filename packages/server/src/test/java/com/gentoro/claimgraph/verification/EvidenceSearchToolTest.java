package com.gentoro.claimgraph.verification;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.gentoro.claimgraph.llm.ToolProperty;
import com.gentoro.claimgraph.model.EvidenceSource;
import com.gentoro.claimgraph.prompt.PromptRenderer;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class EvidenceSearchToolTest {
  @Mock EvidenceSearch evidenceSearch;

  @Test
  void declaresQueryAsTheOnlyRequiredParameter() {
    EvidenceSearchTool tool = new EvidenceSearchTool(evidenceSearch, new PromptRenderer(), 5);

    assertEquals("search_exa", tool.name());
    assertEquals(
        List.of("query"),
        tool.definition().parameters().stream()
            .filter(ToolProperty::required)
            .map(ToolProperty::name)
            .toList());
  }

  @Test
  void formatsResultsForTheModel() {
    when(evidenceSearch.search("rates", 5))
        .thenReturn(List.of(new EvidenceSource("Rates hold", "https://r", "Unchanged again.")));
    EvidenceSearchTool tool = new EvidenceSearchTool(evidenceSearch, new PromptRenderer(), 5);

    String text = tool.execute(Map.of("query", "  rates "));

    assertTrue(text.startsWith("1. Rates hold"));
    assertTrue(text.contains("URL: https://r"));
    assertEquals(1, tool.collected().size());
  }

  @Test
  void emptyResultSaysSo() {
    when(evidenceSearch.search("nothing", 2)).thenReturn(List.of());
    EvidenceSearchTool tool = new EvidenceSearchTool(evidenceSearch, new PromptRenderer(), 2);

    assertEquals("No results found.", tool.execute(Map.of("query", "nothing")));
  }

  @Test
  void blankQueryIsNotSearched() {
    EvidenceSearchTool tool = new EvidenceSearchTool(evidenceSearch, new PromptRenderer(), 5);
    Map<String, Object> arguments = new HashMap<>();
    arguments.put("query", null);

    assertEquals("No query given.", tool.execute(arguments));
    assertEquals("No query given.", tool.execute(Map.of()));
    verifyNoInteractions(evidenceSearch);
  }
}
