package com.diaview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

public class Compositor
{

	private static final Logger log = LoggerFactory.getLogger(Compositor.class);

	/**
	 * Paints every layer of {@code chain} bottom to top. The first layer becomes
	 * the canvas and fixes the output size; later layers are blended at the
	 * origin and clipped to it.
	 */
	public static BufferedImage render(List<String> chain, AssetCatalog catalog, Path archive) throws RenderException
	{
		if (chain == null || chain.isEmpty())
		{
			throw RenderException.invalidArgument("Layer chain cannot be empty");
		}

		String baseId = chain.get(0);
		BufferedImage canvas = loadLayer(baseId, catalog, archive);
		log.debug("Base layer '{}': {}x{}", baseId, canvas.getWidth(), canvas.getHeight());

		for (int i = 1; i < chain.size(); i++)
		{
			String overlayId = chain.get(i);
			BufferedImage overlay = loadLayer(overlayId, catalog, archive);
			log.debug("Overlay '{}': {}x{}", overlayId, overlay.getWidth(), overlay.getHeight());
			drawOver(canvas, overlay);
		}

		return canvas;
	}

	private static BufferedImage loadLayer(String id, AssetCatalog catalog, Path archive) throws RenderException
	{
		String filename = catalog.filenameOf(id).orElseThrow(() -> RenderException.assetNotFound(id));
		byte[] data = ArchiveReader.readEntry(archive, filename);
		return ImageDecoder.decode(data, filename);
	}

	/**
	 * Blends {@code overlay} onto {@code canvas} over the region both cover,
	 * anchored at (0,0). Canvas pixels outside that region are left as they are.
	 */
	static void drawOver(BufferedImage canvas, BufferedImage overlay)
	{
		int w = Math.min(overlay.getWidth(), canvas.getWidth());
		int h = Math.min(overlay.getHeight(), canvas.getHeight());
		if (w <= 0 || h <= 0) return;

		int[] dstRow = new int[w];
		int[] srcRow = new int[w];
		for (int y = 0; y < h; y++)
		{
			canvas.getRGB(0, y, w, 1, dstRow, 0, w);
			overlay.getRGB(0, y, w, 1, srcRow, 0, w);
			for (int x = 0; x < w; x++)
			{
				dstRow[x] = blendOver(dstRow[x], srcRow[x]);
			}
			canvas.setRGB(0, y, w, 1, dstRow, 0, w);
		}
	}

	/**
	 * Porter-Duff "over" on non-premultiplied ARGB, 8 bits per channel.
	 */
	static int blendOver(int dst, int src)
	{
		int sa = (src >>> 24) & 0xFF;
		if (sa == 0) return dst;
		if (sa == 255) return src;

		int da = (dst >>> 24) & 0xFF;
		// Weights scaled by 255
		int ws = sa * 255;
		int wd = da * (255 - sa);
		int wOut = ws + wd;

		int a = (wOut + 127) / 255;
		int r = blendChannel((src >> 16) & 0xFF, (dst >> 16) & 0xFF, ws, wd, wOut);
		int g = blendChannel((src >> 8) & 0xFF, (dst >> 8) & 0xFF, ws, wd, wOut);
		int b = blendChannel(src & 0xFF, dst & 0xFF, ws, wd, wOut);
		return (a << 24) | (r << 16) | (g << 8) | b;
	}

	private static int blendChannel(int sc, int dc, int ws, int wd, int wOut)
	{
		return (sc * ws + dc * wd + wOut / 2) / wOut;
	}
}
