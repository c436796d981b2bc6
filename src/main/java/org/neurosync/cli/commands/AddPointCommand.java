package org.neurosync.cli.commands;

import org.neurosync.annotation.Annotation;
import org.neurosync.annotation.Vec3;
import org.neurosync.http.CancellationToken;
import org.neurosync.source.NeurosyncContext;
import org.neurosync.source.RemoteCollection;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

@Command(
    name = "add-point",
    description = "Adds a point annotation to a source"
)
public class AddPointCommand extends AbstractSourceCommand {

    @Parameters(index = "1", description = "x coordinate")
    private double x;

    @Parameters(index = "2", description = "y coordinate")
    private double y;

    @Parameters(index = "3", description = "z coordinate")
    private double z;

    @Option(names = "--comment", description = "Free-text comment, or ${<json>:JSON} to set properties")
    private String comment;

    @Option(names = "--title", description = "Title of the point")
    private String title;

    @Option(names = "--kind", description = "Kind of the point (default: the kind of the source)")
    private String kind;

    @Override
    protected int run(NeurosyncContext context, RemoteCollection collection) {
        // The conflict check needs the current state of the collection.
        await(context.chunkSource(collection).download(false, CancellationToken.none()));

        Annotation.Builder builder = Annotation.point(Vec3.of(x, y, z)).kind(kind).description(comment);
        if (title != null) {
            builder.putProp(Annotation.PROP_TITLE, title);
        }
        String id = await(context.annotationSource(collection).add(builder.build(), CancellationToken.none()));
        out().println(id);
        return 0;
    }
}
