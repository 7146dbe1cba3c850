package info.isaksson.erland.onemodel;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainDaeModeSmokeTest {

    @Test
    void runsInDaeModeAndEmitsMatlabOnly(@TempDir Path tmp) throws IOException {
        Path out = tmp.resolve("out");

        int code = Main.run(new String[] {
                "--dae", TestRepoPaths.resolveSample("dae/decay-chain.json").toString(),
                "--output", out.toString()
        });

        assertEquals(0, code);
        assertFalse(Files.exists(out.resolve("decay.xml")), "DAE input has no reaction network for SBML");
        String ode = Files.readString(out.resolve("decay_ode.m"));
        assertTrue(ode.contains("function [dx] = decay_ode(t,x,p)\n"), ode);
        assertTrue(ode.contains("dx(3,1) = -C + "), ode);
        assertTrue(Files.readString(out.resolve("report.md")).contains("- Mode: **DAE model**"));
    }

    @Test
    void nameOverridesDaeModelName(@TempDir Path tmp) {
        Path out = tmp.resolve("out");

        int code = Main.run(new String[] {
                "--dae", TestRepoPaths.resolveSample("dae/decay-chain.json").toString(),
                "--output", out.toString(),
                "--name", "chain",
                "--matlab", "class"
        });

        assertEquals(0, code);
        assertTrue(Files.exists(out.resolve("chain.m")));
        assertTrue(Files.exists(out.resolve("chain_example.m")));
    }

    @Test
    void astAndDaeAreMutuallyExclusive(@TempDir Path tmp) {
        Path dae = TestRepoPaths.resolveSample("dae/decay-chain.json");
        assertEquals(1, Main.run(new String[] {"--ast", dae.toString(), "--dae", dae.toString(),
                "--output", tmp.toString()}));
    }
}
