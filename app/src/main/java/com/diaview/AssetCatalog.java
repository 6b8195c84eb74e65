package com.diaview;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable view of an archive manifest: which entry holds each asset id, and
 * which id (if any) each asset is composited on top of.
 */
public final class AssetCatalog
{

	private static final Logger log = LoggerFactory.getLogger(AssetCatalog.class);

	public static final String MANIFEST_ENTRY = "optimization_map.json";

	static final String IMAGE_MAP_MEMBER = "image_map";
	static final String DEPENDENCIES_MEMBER = "dependencies";

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private static final Pattern NATURAL_SORT_SPLIT = Pattern.compile("(\\d+|\\D+)");

	/** Orders ids so numeric runs compare by value: "2" before "10". */
	static final Comparator<String> NATURAL_ORDER = (a, b) -> {
		List<String> partsA = splitNatural(a);
		List<String> partsB = splitNatural(b);
		int len = Math.min(partsA.size(), partsB.size());
		for (int i = 0; i < len; i++)
		{
			String pa = partsA.get(i);
			String pb = partsB.get(i);
			boolean aDigit = isAsciiDigit(pa.charAt(0));
			boolean bDigit = isAsciiDigit(pb.charAt(0));
			int cmp;
			if (aDigit && bDigit)
			{
				cmp = new BigInteger(pa).compareTo(new BigInteger(pb));
				if (cmp == 0) cmp = pa.compareTo(pb); // shorter zero-padding first
			}
			else
			{
				cmp = pa.compareTo(pb);
			}
			if (cmp != 0) return cmp;
		}
		return Integer.compare(partsA.size(), partsB.size());
	};

	private final Map<String, String> imageMap;
	private final Map<String, String> dependencies;

	public AssetCatalog(Map<String, String> imageMap, Map<String, String> dependencies)
	{
		this.imageMap = Map.copyOf(imageMap);
		this.dependencies = Map.copyOf(dependencies);
	}

	/**
	 * Reads and parses the manifest entry of the given archive.
	 */
	public static AssetCatalog load(Path archive) throws RenderException
	{
		byte[] json = ArchiveReader.readEntry(archive, MANIFEST_ENTRY);
		AssetCatalog catalog = parse(json);
		log.info("Loaded {} from {}: {} images, {} dependencies",
				MANIFEST_ENTRY, archive.getFileName(), catalog.imageMap.size(), catalog.dependencies.size());
		return catalog;
	}

	/**
	 * Parses manifest JSON. Only string values are kept under {@code image_map}
	 * and {@code dependencies}; anything else is skipped with a warning.
	 */
	public static AssetCatalog parse(byte[] json) throws RenderException
	{
		JsonNode root;
		try
		{
			root = MAPPER.readTree(json);
		}
		catch (IOException e)
		{
			throw new RenderException(RenderException.Reason.MALFORMED_MANIFEST, MANIFEST_ENTRY,
					"Could not parse JSON: " + e.getMessage(), e);
		}

		if (root == null || !root.isObject())
		{
			throw new RenderException(RenderException.Reason.MALFORMED_MANIFEST, MANIFEST_ENTRY,
					"JSON root is not an object");
		}

		Map<String, String> imageMap = copyStringMembers(root, IMAGE_MAP_MEMBER);
		Map<String, String> dependencies = copyStringMembers(root, DEPENDENCIES_MEMBER);
		AssetCatalog catalog = new AssetCatalog(imageMap, dependencies);
		if (log.isDebugEnabled())
		{
			catalog.dump();
		}
		return catalog;
	}

	private static Map<String, String> copyStringMembers(JsonNode root, String member)
	{
		Map<String, String> out = new LinkedHashMap<>();
		JsonNode node = root.get(member);
		if (node == null)
		{
			return out;
		}
		if (!node.isObject())
		{
			log.warn("Skipping '{}': expected an object but found {}", member, node.getNodeType());
			return out;
		}

		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext())
		{
			Map.Entry<String, JsonNode> field = fields.next();
			if (!field.getValue().isTextual())
			{
				log.warn("Skipping non-string value for key '{}' in '{}'", field.getKey(), member);
				continue;
			}
			out.put(field.getKey(), field.getValue().textValue());
		}
		return out;
	}

	private void dump()
	{
		for (String id : ids())
		{
			log.debug("ID '{}' -> filename '{}'", id, imageMap.get(id));
		}
		List<String> dependents = new ArrayList<>(dependencies.keySet());
		dependents.sort(NATURAL_ORDER);
		for (String id : dependents)
		{
			log.debug("ID '{}' -> depends on '{}'", id, dependencies.get(id));
		}
	}

	public Optional<String> filenameOf(String id)
	{
		return id == null ? Optional.empty() : Optional.ofNullable(imageMap.get(id));
	}

	public Optional<String> parentOf(String id)
	{
		return id == null ? Optional.empty() : Optional.ofNullable(dependencies.get(id));
	}

	/** All ids that name an image entry, in natural order. */
	public List<String> ids()
	{
		List<String> ids = new ArrayList<>(imageMap.keySet());
		ids.sort(NATURAL_ORDER);
		return ids;
	}

	public int size()
	{
		return imageMap.size();
	}

	private static boolean isAsciiDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static List<String> splitNatural(String s)
	{
		List<String> parts = new ArrayList<>();
		Matcher m = NATURAL_SORT_SPLIT.matcher(s);
		while (m.find())
		{
			parts.add(m.group());
		}
		return parts;
	}
}
