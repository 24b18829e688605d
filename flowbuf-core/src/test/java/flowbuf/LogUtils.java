package flowbuf;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import org.apache.logging.log4j.jul.Log4jBridgeHandler;

import io.netty.util.internal.logging.InternalLoggerFactory;
import io.netty.util.internal.logging.Log4J2LoggerFactory;

public class LogUtils {

    public static void configure() {
        System.setProperty("Log4jContextSelector", "org.apache.logging.log4j.core.selector.BasicContextSelector");
        Log4jBridgeHandler.install(true, "", true);
        InternalLoggerFactory.setDefaultFactory(Log4J2LoggerFactory.INSTANCE);
    }

    /**
     * Silent when run by surefire, otherwise the test and the packages under
     * test log at the given level.
     */
    public static void setLevel(Logger logger, Level level, String... packages) {
        if (Tools.isInMaven()) {
            Configurator.setRootLevel(Level.OFF);
        } else {
            Configurator.setRootLevel(Level.ERROR);
            Configurator.setLevel(logger.getName(), level);
            for (String p : packages) {
                Configurator.setLevel(p, level);
            }
        }
    }

}
