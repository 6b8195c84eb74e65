package com.diaview;

import com.formdev.flatlaf.themes.FlatMacDarkLaf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.SwingUtilities;
import java.nio.file.Path;

public class DiaViewApp
{

	private static final Logger log = LoggerFactory.getLogger(DiaViewApp.class);

	public static void main(String[] args)
	{
		if (args.length < 1)
		{
			System.err.println("Usage: diaview <path/to/archive.dia>");
			System.exit(1);
			return;
		}

		LayeredArchive archive;
		try
		{
			archive = LayeredArchive.open(Path.of(args[0]));
		}
		catch (RenderException e)
		{
			log.error("Could not open {}: {}", args[0], e.getMessage());
			System.exit(1);
			return;
		}

		FlatMacDarkLaf.setup();
		SwingUtilities.invokeLater(() -> {
			ViewerFrame frame = new ViewerFrame(archive);
			frame.setVisible(true);
		});
	}
}
