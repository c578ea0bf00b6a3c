package com.wordgraph.lattice.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.wordgraph.lattice.dto.BuildLatticeRequest;
import com.wordgraph.lattice.dto.BuildLatticeResponse;
import com.wordgraph.lattice.dto.LatticeSummary;
import com.wordgraph.lattice.dto.RejectedRecord;
import com.wordgraph.lattice.dto.graph.GraphMetadata;
import com.wordgraph.lattice.dto.graph.GraphNode;
import com.wordgraph.lattice.dto.graph.IntegrityReport;
import com.wordgraph.lattice.dto.graph.NodePathsResponse;
import com.wordgraph.lattice.exception.IntegrityViolationException;
import com.wordgraph.lattice.exception.LatticeNotFoundException;
import com.wordgraph.lattice.exception.MalformedInputException;
import com.wordgraph.lattice.exception.UnreachableNodeReferenceException;
import com.wordgraph.lattice.model.NodeKind;
import com.wordgraph.lattice.service.LatticeService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(LatticeController.class)
class LatticeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private LatticeService latticeService;

    @Test
    void buildLattice_returnsCreated() throws Exception {
        when(latticeService.buildLattice(any())).thenReturn(BuildLatticeResponse.builder()
                .latticeId("ab12cd34")
                .metadata(GraphMetadata.builder().nodeCount(8).edgeCount(9).build())
                .rejectedRecords(List.of())
                .build());

        mockMvc.perform(post("/api/lattices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                BuildLatticeRequest.builder().words(List.of("cats", "rats", "bats")).build())))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.latticeId").value("ab12cd34"))
                .andExpect(jsonPath("$.metadata.nodeCount").value(8));
    }

    @Test
    void buildLattice_returnsBadRequest_whenWordsMissing() throws Exception {
        mockMvc.perform(post("/api/lattices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.words").value("words must be provided"));
    }

    @Test
    void buildLattice_returnsBadRequest_whenInputIsMalformed() throws Exception {
        RejectedRecord rejected = RejectedRecord.builder().index(1).value("a b").reason("embedded whitespace at position 1").build();
        when(latticeService.buildLattice(any()))
                .thenThrow(new MalformedInputException("Malformed record at index 1: embedded whitespace at position 1", List.of(rejected)));

        mockMvc.perform(post("/api/lattices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("words", List.of("ok", "a b"), "failFast", true))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.details.rejectedRecords[0].index").value(1));
    }

    @Test
    void buildLattice_returnsServerError_whenIntegrityViolated() throws Exception {
        IntegrityReport report = IntegrityReport.builder()
                .expectedWordCount(2)
                .reconstructedWordCount(2)
                .missingWord("cat")
                .unexpectedWord("cog")
                .build();
        when(latticeService.buildLattice(any())).thenThrow(new IntegrityViolationException(report));

        mockMvc.perform(post("/api/lattices")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("words", List.of("cat", "dog")))))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.details.missingWords[0]").value("cat"))
                .andExpect(jsonPath("$.details.unexpectedWords[0]").value("cog"));
    }

    @Test
    void listLattices_returnsSummaries() throws Exception {
        when(latticeService.listLattices()).thenReturn(List.of(
                LatticeSummary.builder().latticeId("ab12cd34").wordCount(3).nodeCount(8).edgeCount(9).build()));

        mockMvc.perform(get("/api/lattices"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].latticeId").value("ab12cd34"))
                .andExpect(jsonPath("$[0].wordCount").value(3));
    }

    @Test
    void getNodePaths_returnsPaths() throws Exception {
        GraphNode node = GraphNode.builder().id(2).label("a").kind(NodeKind.CHARACTER).level(2).build();
        when(latticeService.getNodePaths("ab12cd34", 2)).thenReturn(NodePathsResponse.builder()
                .node(node)
                .prefixes(List.of("ca"))
                .suffixes(List.of("p", "t"))
                .words(List.of("cap", "cat"))
                .build());

        mockMvc.perform(get("/api/lattices/ab12cd34/nodes/2/paths"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.node.label").value("a"))
                .andExpect(jsonPath("$.words[1]").value("cat"))
                .andExpect(jsonPath("$.truncated").value(false));
    }

    @Test
    void getNodePaths_returnsNotFound_whenNodeIsUnknown() throws Exception {
        when(latticeService.getNodePaths("ab12cd34", 99)).thenThrow(new UnreachableNodeReferenceException(99));

        mockMvc.perform(get("/api/lattices/ab12cd34/nodes/99/paths"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.details.nodeId").value(99));
    }

    @Test
    void getGraph_returnsNotFound_whenLatticeIsUnknown() throws Exception {
        when(latticeService.getSnapshot("nope", null)).thenThrow(new LatticeNotFoundException("Lattice not found: nope"));

        mockMvc.perform(get("/api/lattices/nope/graph"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Lattice not found: nope"));
    }

    @Test
    void deleteLattice_returnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/lattices/ab12cd34"))
                .andExpect(status().isNoContent());

        verify(latticeService).deleteLattice("ab12cd34");
    }

    @Test
    void deleteLattice_returnsNotFound_whenLatticeIsUnknown() throws Exception {
        doThrow(new LatticeNotFoundException("Lattice not found: nope")).when(latticeService).deleteLattice("nope");

        mockMvc.perform(delete("/api/lattices/nope"))
                .andExpect(status().isNotFound());
    }
}
