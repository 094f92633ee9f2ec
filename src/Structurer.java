import driver.*;
import exception.StructureException;
import util.LoggingManager;

public class Structurer {
    /*
     * move the duty of structurer to driver,
     * for we can't use package here
     */
    public static void main(String[] args) {
        StructureDriver driver = StructureDriver.getInstance();
        try {
            driver.parseArgs(args);
            driver.run();
        } catch (StructureException e) {
            System.err.println(e.getMessage());
            LoggingManager.shutdown();
            System.exit(1);
        }
        LoggingManager.shutdown();
    }
}
