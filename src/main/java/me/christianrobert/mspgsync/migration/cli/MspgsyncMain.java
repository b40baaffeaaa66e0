package me.christianrobert.mspgsync.migration.cli;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import me.christianrobert.mspgsync.migration.service.MigrationRunService;
import me.christianrobert.mspgsync.script.service.ScriptConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Without arguments the REST server runs until shutdown; with arguments the command line
 * is executed and its exit code returned.
 */
@QuarkusMain
public class MspgsyncMain implements QuarkusApplication {

    private static final Logger log = LoggerFactory.getLogger(MspgsyncMain.class);

    @Inject
    MigrationRunService migrationRunService;

    @Inject
    ScriptConversionService scriptConversionService;

    public static void main(String... args) {
        Quarkus.run(MspgsyncMain.class, args);
    }

    @Override
    public int run(String... args) {
        if (args.length == 0) {
            log.info("No command given, serving the REST API");
            Quarkus.waitForExit();
            return 0;
        }
        return new MigrationCommand(migrationRunService, scriptConversionService)
                .commandLine()
                .execute(args);
    }
}
