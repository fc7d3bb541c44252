package ai.puzzles.web;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/**
 * End-to-end tests of the HTTP surface against the real solver.
 */
@SpringBootTest
@AutoConfigureMockMvc
class SolveControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void solvesBoardWithBreadthFirstSearch() throws Exception {
        mockMvc.perform(post("/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"board\":[[1,2,3],[4,0,6],[7,5,8]],\"algorithm\":\"BFS\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.algorithm").value("BFS"))
                .andExpect(jsonPath("$.solution_depth").value(2))
                .andExpect(jsonPath("$.solution_path", hasSize(3)))
                .andExpect(jsonPath("$.solution_path[0][1][1]").value(0))
                .andExpect(jsonPath("$.solution_path[2][2][2]").value(0))
                .andExpect(jsonPath("$.nodes_expanded").isNumber())
                .andExpect(jsonPath("$.time_taken").isNumber())
                .andExpect(jsonPath("$.max_queue_size").isNumber())
                .andExpect(jsonPath("$.max_stack_size").doesNotExist());
    }

    @Test
    void depthFirstReportsStackSize() throws Exception {
        mockMvc.perform(post("/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"board\":[[1,2],[0,3]],\"algorithm\":\"DFS\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.algorithm").value("DFS"))
                .andExpect(jsonPath("$.max_stack_size").isNumber())
                .andExpect(jsonPath("$.depth_limit").value(50))
                .andExpect(jsonPath("$.max_queue_size").doesNotExist());
    }

    @Test
    void unsolvableBoardReturnsErrorWithInversions() throws Exception {
        mockMvc.perform(post("/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"board\":[[1,2,3],[4,5,6],[8,7,0]],\"algorithm\":\"A*\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("UNSOLVABLE"))
                .andExpect(jsonPath("$.inversions").value(1))
                .andExpect(jsonPath("$.error", containsString("not solvable")))
                .andExpect(jsonPath("$.solution_path").doesNotExist());
    }

    @Test
    void unsupportedSizeIsBadRequest() throws Exception {
        mockMvc.perform(post("/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"board\":[[1,2,3,4],[5,6,7,8],[9,10,11,12],[13,14,15,0]],\"algorithm\":\"A*\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.status").value("UNSUPPORTED_SIZE"))
                .andExpect(jsonPath("$.error", containsString("Only 2x2 and 3x3")));
    }

    @Test
    void unknownAlgorithmIsBadRequest() throws Exception {
        mockMvc.perform(post("/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"board\":[[1,2],[3,0]],\"algorithm\":\"IDA*\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown algorithm: IDA*"));
    }

    @Test
    void unreadableBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"board\": [[1,2],[3,"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error", containsString("Error processing request")));
    }

    @Test
    void healthReportsSupportedSizes() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.supported_sizes", hasSize(2)));
    }

    @Test
    void shuffleReturnsBoardOfRequestedSize() throws Exception {
        mockMvc.perform(get("/shuffle").param("size", "2").param("moves", "10").param("seed", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.size").value(2))
                .andExpect(jsonPath("$.board", hasSize(2)));
    }

    @Test
    void shuffleRejectsUnsupportedSize() throws Exception {
        mockMvc.perform(get("/shuffle").param("size", "5"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void goalReturnsCanonicalBoard() throws Exception {
        mockMvc.perform(get("/goal").param("size", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.board[0][0]").value(1))
                .andExpect(jsonPath("$.board[2][2]").value(0));
    }
}
