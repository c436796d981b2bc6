package org.neurosync.cli.commands;

import org.neurosync.http.CancellationToken;
import org.neurosync.source.NeurosyncContext;
import org.neurosync.source.RemoteCollection;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(
    name = "delete",
    description = "Deletes an annotation from a source"
)
public class DeleteCommand extends AbstractSourceCommand {

    @Parameters(index = "1", description = "Annotation id as printed by 'list'")
    private String annotationId;

    @Override
    protected int run(NeurosyncContext context, RemoteCollection collection) {
        // Ownership is checked against the downloaded entry.
        await(context.chunkSource(collection).download(false, CancellationToken.none()));
        await(context.annotationSource(collection).delete(annotationId, CancellationToken.none()));
        out().println("Deleted " + annotationId);
        return 0;
    }
}
