package histograph.cli.mixins;

import picocli.CommandLine.IVersionProvider;
import java.io.InputStream;
import java.util.Properties;

public class VersionProvider implements IVersionProvider {

    @Override
    public String[] getVersion() throws Exception {
        Properties props = new Properties();
        try (InputStream is = getClass().getResourceAsStream("/histo-graph-version.properties")) {
            if (is != null) {
                props.load(is);
            }
        }

        String version = props.getProperty("version", "1.0.0-SNAPSHOT");
        String buildTime = props.getProperty("build.time", "unknown");

        return new String[] {
                "@|bold histo-graph|@ version @|green " + version + "|@",
                "Built: " + buildTime,
                "Java: " + System.getProperty("java.version"),
                "JVM: " + System.getProperty("java.vm.name") + " " + System.getProperty("java.vm.version")
        };
    }
}
