package com.diaview;

import javax.swing.Icon;
import javax.swing.JPanel;
import javax.swing.UIManager;
import java.awt.Color;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.Insets;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;

/**
 * Shows the last rendered composite centered, shrunk to fit but never
 * enlarged, over a checkerboard. Size changes simply repaint at the new scale.
 */
class CompositePreviewPanel extends JPanel
{
	private static final Color CHECK_LIGHT = new Color(204, 204, 204);
	private static final Color CHECK_DARK = new Color(153, 153, 153);
	private static final int CHECK_SIZE = 8;
	private static final int MARGIN = 5;

	private BufferedImage image;
	private String errorMessage;

	void setImage(BufferedImage img)
	{
		this.image = img;
		this.errorMessage = null;
		repaint();
	}

	void showError(String message)
	{
		this.image = null;
		this.errorMessage = message;
		repaint();
	}

	BufferedImage getImage()
	{
		return image;
	}

	static double fitScale(int imgW, int imgH, int areaW, int areaH)
	{
		if (imgW <= 0 || imgH <= 0 || areaW <= 0 || areaH <= 0) return 0;
		double scale = Math.min((double) areaW / imgW, (double) areaH / imgH);
		return Math.min(scale, 1.0);
	}

	@Override
	protected void paintComponent(Graphics g)
	{
		super.paintComponent(g);
		if (image == null)
		{
			paintPlaceholder(g);
			return;
		}

		Insets insets = getInsets();
		int areaW = getWidth() - insets.left - insets.right - MARGIN;
		int areaH = getHeight() - insets.top - insets.bottom - MARGIN;
		double scale = fitScale(image.getWidth(), image.getHeight(), areaW, areaH);
		if (scale <= 0) return;

		int drawW = (int) (image.getWidth() * scale);
		int drawH = (int) (image.getHeight() * scale);
		if (drawW <= 0 || drawH <= 0) return;
		int drawX = insets.left + (areaW - drawW) / 2;
		int drawY = insets.top + (areaH - drawH) / 2;

		Graphics2D g2 = (Graphics2D) g;
		for (int cy = 0; cy < drawH; cy += CHECK_SIZE)
		{
			for (int cx = 0; cx < drawW; cx += CHECK_SIZE)
			{
				g2.setColor(((cx / CHECK_SIZE + cy / CHECK_SIZE) % 2 == 0) ? CHECK_LIGHT : CHECK_DARK);
				g2.fillRect(drawX + cx, drawY + cy,
						Math.min(CHECK_SIZE, drawW - cx),
						Math.min(CHECK_SIZE, drawH - cy));
			}
		}

		g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
		g2.drawImage(image, drawX, drawY, drawW, drawH, null);
	}

	private void paintPlaceholder(Graphics g)
	{
		String msg = errorMessage != null ? errorMessage : "No selection";
		int textY = getHeight() / 2;
		if (errorMessage != null)
		{
			// Stands in for the missing image
			Icon icon = UIManager.getIcon("OptionPane.errorIcon");
			if (icon != null)
			{
				icon.paintIcon(this, g, (getWidth() - icon.getIconWidth()) / 2, textY - icon.getIconHeight() - 8);
			}
		}
		g.setColor(Color.GRAY);
		int sw = g.getFontMetrics().stringWidth(msg);
		g.drawString(msg, Math.max(4, (getWidth() - sw) / 2), textY + g.getFontMetrics().getAscent());
	}
}
