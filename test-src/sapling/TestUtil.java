package sapling;

import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;

import org.junit.Ignore;

import com.google.common.base.Charsets;
import com.google.common.io.Files;

@Ignore
public class TestUtil {
  public static File find_test_file( String fname ) {
    // When run from an IDE, the working directory may differ.
    // Try pointing at another likely place
    File file = new File(fname);
    if( !file.exists() ) file = new File("../"+fname);
    return file;
  }

  public static String read_test_file( String fname ) {
    File file = find_test_file(fname);
    try {
      return Files.asCharSource(file, Charsets.UTF_8).read();
    } catch( IOException e ) {
      fail("failed to read "+file.getPath()+": "+e);
      return null;
    }
  }

  public static final String CONTACT_LENSES = "smalldata/arff/contact-lenses.arff";
  public static final String RESTAURANT     = "smalldata/arff/restaurant.arff";
  public static final String WEATHER        = "smalldata/arff/weather.arff";
}
