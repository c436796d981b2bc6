package org.neurosync.cli.commands;

import org.neurosync.api.AnnotationSyncException;
import org.neurosync.cli.CommandLineInterface;
import org.neurosync.http.CancellationToken;
import org.neurosync.source.NeurosyncContext;
import org.neurosync.source.RemoteCollection;
import org.neurosync.source.SourceParameters;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Base of the commands that act on one annotation source URL. Failures are reported on
 * stderr with exit code 1.
 */
abstract class AbstractSourceCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Annotation source URL, e.g. https://host/v2/dataset?user=alice")
    protected String sourceUrl;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    protected CommandSpec spec;

    @Override
    public Integer call() {
        try {
            NeurosyncContext context = parent.getContext();
            SourceParameters parameters = await(context.resolve(sourceUrl, CancellationToken.none()));
            return run(context, context.open(parameters));
        } catch (AnnotationSyncException e) {
            err().println("Error: " + e.getMessage());
            return 1;
        } catch (CancellationException e) {
            err().println("Cancelled");
            return 1;
        }
    }

    protected abstract int run(NeurosyncContext context, RemoteCollection collection);

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Waits for {@code future} and rethrows its failure unwrapped.
     */
    protected static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof AnnotationSyncException cause) {
                throw cause;
            }
            if (e.getCause() instanceof CancellationException cause) {
                throw cause;
            }
            throw new AnnotationSyncException(String.valueOf(e.getCause().getMessage()), e.getCause());
        }
    }
}
