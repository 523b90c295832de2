package gpurace.exec;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Provides access to the properties recorded at build time in the file
 * {@code build.cfg}, which is packaged next to this class.
 */
public class BuildConfig
{
	private static BuildConfig buildConfig = null;
	private final Properties properties = new Properties();

	private BuildConfig()
	{
		final InputStream cfg = BuildConfig.class.getResourceAsStream("build.cfg");
		if( cfg == null ) {
			throw new IllegalStateException("could not find config file");
		}
		try( InputStream in = cfg ) {
			properties.load(in);
		} catch (IOException e) {
			throw new IllegalStateException("failure reading config file: " + e);
		}
	}

	/** Get the configuration singleton. */
	public static BuildConfig getBuildConfig()
	{
		if( buildConfig != null ) {
			return buildConfig;
		}
		return buildConfig = new BuildConfig();
	}

	/**
	 * Get the value of a property.
	 *
	 * @param name the property's name
	 * @return the property's value
	 * @throws IllegalStateException if the property is not defined in {@code build.cfg}
	 */
	public String getProperty(String name)
	{
		final String value = properties.getProperty(name);
		if( value == null ) {
			throw new IllegalStateException("config property is missing: " + name);
		}
		return value;
	}
}
