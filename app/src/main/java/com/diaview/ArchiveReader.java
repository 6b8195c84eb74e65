package com.diaview;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Reads single entries out of a zip archive. Every call opens the archive on
 * its own and closes it before returning, so no handle outlives a read.
 */
public final class ArchiveReader
{

	private ArchiveReader()
	{
	}

	public static byte[] readEntry(Path archive, String entryName) throws RenderException
	{
		if (entryName == null || entryName.isEmpty())
		{
			throw RenderException.invalidArgument("Inner filename cannot be empty");
		}
		if (archive == null)
		{
			throw RenderException.invalidArgument("Archive path cannot be null");
		}

		ZipFile zip;
		try
		{
			zip = new ZipFile(archive.toFile());
		}
		catch (IOException e)
		{
			throw new RenderException(RenderException.Reason.OPEN_FAILED, archive.toString(),
					"Failed to open zip archive '" + archive + "': " + e.getMessage(), e);
		}

		try (zip)
		{
			ZipEntry entry = zip.getEntry(entryName);
			if (entry == null || entry.isDirectory() || !entry.getName().equals(entryName))
			{
				throw new RenderException(RenderException.Reason.NOT_FOUND, entryName,
						"File not found in zip archive: " + entryName);
			}
			return readFully(zip, entry);
		}
		catch (RenderException e)
		{
			throw e;
		}
		catch (IOException e)
		{
			throw new RenderException(RenderException.Reason.READ_FAILED, entryName,
					"Failed to read '" + entryName + "' from zip archive: " + e.getMessage(), e);
		}
	}

	private static byte[] readFully(ZipFile zip, ZipEntry entry) throws IOException
	{
		long declared = entry.getSize();
		if (declared > Integer.MAX_VALUE - 8)
		{
			throw new RenderException(RenderException.Reason.READ_FAILED, entry.getName(),
					"Entry too large to buffer: " + entry.getName() + " (" + declared + " bytes)");
		}

		try (InputStream in = zip.getInputStream(entry))
		{
			// Size is unknown (-1) only for streamed entries without a central directory size
			if (declared < 0)
			{
				return in.readAllBytes();
			}
			byte[] data = in.readNBytes((int) declared);
			if (data.length != declared)
			{
				throw new RenderException(RenderException.Reason.READ_FAILED, entry.getName(),
						"Failed to read all bytes from '" + entry.getName() + "' in zip archive ("
						+ data.length + " of " + declared + ")");
			}
			return data;
		}
	}
}
