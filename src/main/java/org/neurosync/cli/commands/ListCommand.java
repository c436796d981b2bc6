package org.neurosync.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.neurosync.annotation.Annotation;
import org.neurosync.api.AnnotationSyncException;
import org.neurosync.http.CancellationToken;
import org.neurosync.source.AnnotationGeometryChunk;
import org.neurosync.source.NeurosyncContext;
import org.neurosync.source.RemoteCollection;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintWriter;

@Command(
    name = "list",
    description = "Downloads and lists all annotations of a source"
)
public class ListCommand extends AbstractSourceCommand {

    @Option(
        names = {"-f", "--format"},
        description = "Output format: summary, json (default: summary)"
    )
    private String format = "summary";

    @Override
    protected int run(NeurosyncContext context, RemoteCollection collection) {
        AnnotationGeometryChunk chunk = await(context.chunkSource(collection).download(false, CancellationToken.none()));
        switch (format.toLowerCase()) {
            case "json" -> printJson(context, chunk);
            case "summary" -> printSummary(chunk);
            default -> {
                err().println("Unknown format: " + format + ". Supported formats: summary, json");
                return 2;
            }
        }
        return 0;
    }

    private void printSummary(AnnotationGeometryChunk chunk) {
        PrintWriter out = out();
        for (Annotation annotation : chunk.annotations()) {
            out.printf("%-40s %-7s %-8s %s%s  %s%n",
                annotation.getId(),
                annotation.getType(),
                annotation.getKind() == null ? "" : annotation.getKind(),
                annotation.getPointA().toKeyString(),
                annotation.getPointB() == null ? "" : " - " + annotation.getPointB().toKeyString(),
                annotation.getPresentation());
        }
        out.println(chunk.annotations().size() + " annotation(s)");
    }

    private void printJson(NeurosyncContext context, AnnotationGeometryChunk chunk) {
        ArrayNode array = context.getMapper().createArrayNode();
        for (Annotation annotation : chunk.annotations()) {
            ObjectNode node = array.addObject();
            node.put("id", annotation.getId());
            node.put("type", annotation.getType().name());
            node.put("kind", annotation.getKind());
            node.set("pointA", context.getMapper().valueToTree(annotation.getPointA().toList()));
            if (annotation.getPointB() != null) {
                node.set("pointB", context.getMapper().valueToTree(annotation.getPointB().toList()));
            }
            node.put("user", annotation.getUser());
            node.put("title", annotation.getTitle());
            node.put("comment", annotation.getComment());
            node.put("checked", annotation.isChecked());
        }
        try {
            out().println(context.getMapper().writerWithDefaultPrettyPrinter().writeValueAsString(array));
        } catch (JsonProcessingException e) {
            throw new AnnotationSyncException("Unable to render annotations: " + e.getOriginalMessage(), e);
        }
    }
}
