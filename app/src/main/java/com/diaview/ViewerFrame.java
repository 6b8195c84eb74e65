package com.diaview;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.BorderFactory;
import javax.swing.DefaultListCellRenderer;
import javax.swing.DefaultListModel;
import javax.swing.JFrame;
import javax.swing.JLabel;
import javax.swing.JList;
import javax.swing.JPanel;
import javax.swing.JProgressBar;
import javax.swing.JScrollPane;
import javax.swing.JSplitPane;
import javax.swing.ListSelectionModel;
import javax.swing.SwingWorker;
import java.awt.BorderLayout;
import java.awt.Component;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;

/**
 * Asset list on the left, rendered composite on the right. Each selection
 * starts a background render; a newer selection cancels the one in flight.
 */
public class ViewerFrame extends JFrame
{

	private static final Logger log = LoggerFactory.getLogger(ViewerFrame.class);

	private final LayeredArchive archive;
	private final JList<String> idList;
	private final CompositePreviewPanel previewPanel;
	private final JProgressBar busyBar;
	private final JLabel statusLabel;
	private SwingWorker<BufferedImage, Void> activeRenderWorker;

	public ViewerFrame(LayeredArchive archive)
	{
		super(String.valueOf(archive.path().getFileName()));
		this.archive = archive;
		setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
		setMinimumSize(new Dimension(400, 300));
		setPreferredSize(new Dimension(800, 600));

		DefaultListModel<String> model = new DefaultListModel<>();
		for (String id : archive.catalog().ids())
		{
			model.addElement(id);
		}
		idList = new JList<>(model);
		idList.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
		idList.setCellRenderer(new DefaultListCellRenderer()
		{
			@Override
			public Component getListCellRendererComponent(JList<?> list, Object value, int index,
														  boolean isSelected, boolean cellHasFocus)
			{
				String id = (String) value;
				String label = archive.catalog().filenameOf(id).orElse(id);
				return super.getListCellRendererComponent(list, label, index, isSelected, cellHasFocus);
			}
		});
		idList.addListSelectionListener(e -> {
			if (e.getValueIsAdjusting()) return;
			String id = idList.getSelectedValue();
			if (id != null) renderSelected(id);
		});

		previewPanel = new CompositePreviewPanel();

		busyBar = new JProgressBar();
		busyBar.setIndeterminate(true);
		busyBar.setVisible(false);
		statusLabel = new JLabel(archive.catalog().size() + " images");
		statusLabel.setBorder(BorderFactory.createEmptyBorder(2, 6, 2, 6));

		JPanel statusPanel = new JPanel(new BorderLayout(8, 0));
		statusPanel.add(statusLabel, BorderLayout.CENTER);
		statusPanel.add(busyBar, BorderLayout.EAST);

		JPanel right = new JPanel(new BorderLayout());
		right.add(previewPanel, BorderLayout.CENTER);
		right.add(statusPanel, BorderLayout.SOUTH);

		JSplitPane split = new JSplitPane(JSplitPane.HORIZONTAL_SPLIT, new JScrollPane(idList), right);
		split.setDividerLocation(200);
		add(split, BorderLayout.CENTER);
		pack();
		setLocationRelativeTo(null);
	}

	private void renderSelected(String id)
	{
		// Supersede whatever is still rendering
		if (activeRenderWorker != null)
		{
			activeRenderWorker.cancel(true);
			activeRenderWorker = null;
		}

		busyBar.setVisible(true);
		statusLabel.setText("Rendering " + id + "\u2026");

		SwingWorker<BufferedImage, Void> worker = new SwingWorker<>()
		{
			@Override
			protected BufferedImage doInBackground() throws Exception
			{
				return archive.render(id);
			}

			@Override
			protected void done()
			{
				if (isCancelled() || activeRenderWorker != this) return;
				activeRenderWorker = null;
				busyBar.setVisible(false);
				try
				{
					BufferedImage result = get();
					previewPanel.setImage(result);
					statusLabel.setText(id + ": " + result.getWidth() + "\u00d7" + result.getHeight());
				}
				catch (InterruptedException ex)
				{
					Thread.currentThread().interrupt();
				}
				catch (CancellationException ex)
				{
					log.debug("Render of '{}' cancelled", id);
				}
				catch (ExecutionException ex)
				{
					Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
					log.error("Could not render '{}': {}", id, cause.getMessage());
					previewPanel.showError("Could not render " + id);
					statusLabel.setText("Error: " + cause.getMessage());
				}
			}
		};
		activeRenderWorker = worker;
		worker.execute();
	}
}
