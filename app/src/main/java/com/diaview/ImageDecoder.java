package com.diaview;

import org.apache.commons.imaging.ImageFormat;
import org.apache.commons.imaging.ImageFormats;
import org.apache.commons.imaging.Imaging;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.IIOException;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.MemoryCacheImageInputStream;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Decodes raster bytes into an ARGB image. The format is sniffed from the
 * content, never from a filename.
 */
public final class ImageDecoder
{

	private static final Logger log = LoggerFactory.getLogger(ImageDecoder.class);

	private ImageDecoder()
	{
	}

	public static BufferedImage decode(byte[] bytes) throws RenderException
	{
		return decode(bytes, null);
	}

	/**
	 * @param source entry name reported in errors; may be null
	 * @return a {@code TYPE_INT_ARGB} image; sources without alpha come back fully opaque
	 */
	public static BufferedImage decode(byte[] bytes, String source) throws RenderException
	{
		String label = source != null ? "'" + source + "'" : "image data";
		if (bytes == null || bytes.length == 0)
		{
			throw decodeFailed(source, "Cannot decode " + label + ": no data", null);
		}

		ImageFormat format;
		try
		{
			format = Imaging.guessFormat(bytes);
		}
		catch (IOException e)
		{
			throw decodeFailed(source, "Cannot detect format of " + label + ": " + e.getMessage(), e);
		}
		if (format == null || format == ImageFormats.UNKNOWN)
		{
			throw decodeFailed(source, "Unrecognized image format in " + label, null);
		}

		BufferedImage image;
		try
		{
			image = readWithImageIO(bytes, label);
			if (image == null)
			{
				// No ImageIO reader for this format; Commons Imaging covers the rest
				log.debug("ImageIO has no reader for {} ({}), using Commons Imaging", label, format);
				image = Imaging.getBufferedImage(bytes);
			}
		}
		catch (IOException | RuntimeException e)
		{
			throw decodeFailed(source, "Failed to decode " + label + " as " + format + ": " + e.getMessage(), e);
		}
		if (image == null)
		{
			throw decodeFailed(source, "Failed to decode " + label + " as " + format, null);
		}

		return toArgb(image);
	}

	/**
	 * Reads the first image through ImageIO, buffering in memory only. Readers
	 * report damaged data such as a premature end of JPEG as warnings, so any
	 * warning fails the decode.
	 *
	 * @return null when no ImageIO reader accepts the data
	 */
	private static BufferedImage readWithImageIO(byte[] bytes, String label) throws IOException
	{
		try (ImageInputStream in = new MemoryCacheImageInputStream(new ByteArrayInputStream(bytes)))
		{
			Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
			if (!readers.hasNext())
			{
				return null;
			}
			ImageReader reader = readers.next();
			List<String> warnings = new ArrayList<>();
			try
			{
				reader.addIIOReadWarningListener((r, warning) -> warnings.add(warning));
				reader.setInput(in, true, false);
				BufferedImage image = reader.read(0);
				if (!warnings.isEmpty())
				{
					throw new IIOException("Damaged image data in " + label + ": " + String.join("; ", warnings));
				}
				return image;
			}
			finally
			{
				reader.dispose();
			}
		}
	}

	/**
	 * Copies into a non-premultiplied ARGB image. {@code getRGB} reports alpha
	 * 255 for color models without alpha, which is what synthesizes opacity.
	 */
	static BufferedImage toArgb(BufferedImage src)
	{
		if (src.getType() == BufferedImage.TYPE_INT_ARGB)
		{
			return src;
		}
		ColorModel cm = src.getColorModel();
		if (!(cm instanceof IndexColorModel) && cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY)
		{
			return grayToArgb(src);
		}
		int w = src.getWidth();
		int h = src.getHeight();
		BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
		int[] row = new int[w];
		for (int y = 0; y < h; y++)
		{
			src.getRGB(0, y, w, 1, row, 0, w);
			dst.setRGB(0, y, w, 1, row, 0, w);
		}
		return dst;
	}

	/**
	 * Gray samples are taken as stored. Going through {@code getRGB} would treat
	 * them as linear gray and gamma-convert them to sRGB.
	 */
	private static BufferedImage grayToArgb(BufferedImage src)
	{
		ColorModel cm = src.getColorModel();
		Raster raster = src.getRaster();
		int w = src.getWidth();
		int h = src.getHeight();
		boolean hasAlpha = cm.hasAlpha() && raster.getNumBands() > 1;
		int grayMax = (1 << cm.getComponentSize(0)) - 1;
		int alphaMax = hasAlpha ? (1 << cm.getComponentSize(1)) - 1 : 0;

		BufferedImage dst = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
		int[] gray = new int[w];
		int[] alpha = new int[w];
		int[] row = new int[w];
		for (int y = 0; y < h; y++)
		{
			raster.getSamples(0, y, w, 1, 0, gray);
			if (hasAlpha)
			{
				raster.getSamples(0, y, w, 1, 1, alpha);
			}
			for (int x = 0; x < w; x++)
			{
				int a = hasAlpha ? to8Bit(alpha[x], alphaMax) : 255;
				int v = to8Bit(gray[x], grayMax);
				if (cm.isAlphaPremultiplied() && a != 0 && a != 255)
				{
					v = Math.min(255, (v * 255 + a / 2) / a);
				}
				row[x] = (a << 24) | (v << 16) | (v << 8) | v;
			}
			dst.setRGB(0, y, w, 1, row, 0, w);
		}
		return dst;
	}

	private static int to8Bit(int sample, int max)
	{
		if (max == 255)
		{
			return sample;
		}
		return (int) ((sample * 255L + max / 2) / max);
	}

	private static RenderException decodeFailed(String source, String message, Throwable cause)
	{
		return new RenderException(RenderException.Reason.DECODE_FAILED, source, message, cause);
	}
}
