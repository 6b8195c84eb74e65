package com.diaview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.image.BufferedImage;
import java.nio.file.Path;
import java.util.List;

/**
 * An opened {@code .dia} archive: its path plus the catalog read from its
 * manifest. Stateless beyond that, so one instance can serve concurrent
 * renders; each render rereads and redecodes every layer.
 */
public final class LayeredArchive
{

	private static final Logger log = LoggerFactory.getLogger(LayeredArchive.class);

	private final Path path;
	private final AssetCatalog catalog;

	public LayeredArchive(Path path, AssetCatalog catalog)
	{
		this.path = path;
		this.catalog = catalog;
	}

	public static LayeredArchive open(Path path) throws RenderException
	{
		return new LayeredArchive(path, AssetCatalog.load(path));
	}

	public Path path()
	{
		return path;
	}

	public AssetCatalog catalog()
	{
		return catalog;
	}

	public List<String> resolve(String requestedId) throws RenderException
	{
		return ChainResolver.resolve(catalog, requestedId);
	}

	public BufferedImage render(String requestedId) throws RenderException
	{
		List<String> chain = resolve(requestedId);
		log.debug("Chain for '{}': {}", requestedId, chain);
		BufferedImage image = Compositor.render(chain, catalog, path);
		log.info("Rendered '{}' from {} layer(s) at {}x{}",
				requestedId, chain.size(), image.getWidth(), image.getHeight());
		return image;
	}
}
