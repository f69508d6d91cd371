package com.deepansh.tracer.persistence;

import com.deepansh.tracer.model.Run;
import com.deepansh.tracer.model.RunType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * A completed execution tree stored in MongoDB.
 *
 * Collection: traced_runs
 *
 * The root's identity fields are lifted to the top level for querying;
 * the whole tree, children included, is embedded under "run".
 */
@Document(collection = "traced_runs")
@CompoundIndexes({
    @CompoundIndex(name = "idx_name_date", def = "{'name': 1, 'persistedAt': -1}"),
    @CompoundIndex(name = "idx_type_date", def = "{'runType': 1, 'persistedAt': -1}")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TracedRunDocument {

    /** Root run id */
    @Id
    private String id;

    @Indexed
    private String name;

    private RunType runType;

    private int executionOrder;
    private int childExecutionOrder;

    /** Number of runs in the tree, root included */
    private int runCount;

    private boolean errored;

    private Run run;

    @CreatedDate
    private Instant persistedAt;

    public static TracedRunDocument from(Run root) {
        return TracedRunDocument.builder()
                .id(root.getId())
                .name(root.getName())
                .runType(root.getRunType())
                .executionOrder(root.getExecutionOrder())
                .childExecutionOrder(root.getChildExecutionOrder())
                .runCount(count(root))
                .errored(root.getError() != null)
                .run(root)
                .build();
    }

    private static int count(Run run) {
        return 1 + run.getChildRuns().stream().mapToInt(TracedRunDocument::count).sum();
    }
}
