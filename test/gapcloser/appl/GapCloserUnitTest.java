package gapcloser.appl;

import org.testng.annotations.Test;

import gapcloser.util.ConfigurationException;

public class GapCloserUnitTest {

	@Test(expectedExceptions = ConfigurationException.class)
	public void testNoTool() {
		GapCloser.main(new String[0]);
	}

	@Test(expectedExceptions = ConfigurationException.class)
	public void testUnknownTool() {
		GapCloser.main(new String[]{"scaffold"});
	}

	@Test(expectedExceptions = ConfigurationException.class)
	public void testToolWithoutOptions() {
		GapCloser.main(new String[]{"close"});
	}
}
